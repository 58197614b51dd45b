package hunkstage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HunkstageApplication {
  public static void main(String[] args) {
    SpringApplication.run(HunkstageApplication.class, args);
  }
}
