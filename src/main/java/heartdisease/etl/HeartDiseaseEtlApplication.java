package heartdisease.etl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HeartDiseaseEtlApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeartDiseaseEtlApplication.class, args);
    }
}
