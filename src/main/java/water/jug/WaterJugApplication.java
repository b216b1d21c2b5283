package water.jug;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WaterJugApplication {

	public static void main(String[] args) {
		SpringApplication.run(WaterJugApplication.class, args);
	}

}
