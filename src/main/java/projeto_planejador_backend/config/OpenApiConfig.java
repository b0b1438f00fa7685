package projeto_planejador_backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("API - Planejador de Projetos")
                        .description("Levantamento conversacional de requisitos e geração de planos de projeto com cronograma Gantt")
                        .version("2.0.0")
                        .contact(new Contact()
                                .name("Equipe de Desenvolvimento")
                                .email("suporte@planejadorprojetos.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")));
    }
}
