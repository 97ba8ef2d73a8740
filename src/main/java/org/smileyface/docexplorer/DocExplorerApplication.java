package org.smileyface.docexplorer;

import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExplorerProperties.class)
public class DocExplorerApplication {

	public static void main(String[] args) {
		SpringApplication.run(DocExplorerApplication.class, args);
	}
}
