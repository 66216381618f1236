package github.sarthakdev143.segment_forge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SegmentForgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(SegmentForgeApplication.class, args);
	}

}
