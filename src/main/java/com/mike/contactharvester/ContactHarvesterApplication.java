package com.mike.contactharvester;

import com.mike.contactharvester.config.EmailExtractorProperties;
import com.mike.contactharvester.config.FilterConfig;
import com.mike.contactharvester.config.HarvesterProperties;
import com.mike.contactharvester.config.SerpApiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        HarvesterProperties.class,
        FilterConfig.class,
        EmailExtractorProperties.class,
        SerpApiProperties.class
})
public class ContactHarvesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContactHarvesterApplication.class, args);
    }

}
