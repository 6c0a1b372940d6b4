package com.opsdash.infrastructure.config;

import com.opsdash.infrastructure.filter.RequestIdFilter;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("OpsDash API")
                        .version("1.0")
                        .description("Building operations dashboard. List endpoints page with opaque, "
                                + "encrypted cursors: pass `cursor` and `direction` from a previous response's links."));
    }

    @Bean
    public OperationCustomizer addRequestIdHeader() {
        return (operation, handlerMethod) -> {
            operation.addParametersItem(new Parameter()
                    .in("header")
                    .name(RequestIdFilter.REQUEST_ID_HEADER)
                    .required(false)
                    .description("Correlation id echoed in responses and logs; generated when absent")
                    .schema(new StringSchema()));
            return operation;
        };
    }
}
