package projeto_planejador_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlanejadorDeProjetosApplication {

	public static void main(String[] args) {
		SpringApplication.run(PlanejadorDeProjetosApplication.class, args);
	}

}
