package org.photocollage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhotoCollageApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhotoCollageApplication.class, args);
    }
}
