package combinator.futarchy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FutarchyApplication {

  public static void main(String[] args) {
    SpringApplication.run(FutarchyApplication.class, args);
  }
}
