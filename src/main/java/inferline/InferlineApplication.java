package inferline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InferlineApplication {

  public static void main(String[] args) {
    SpringApplication.run(InferlineApplication.class, args);
  }
}
