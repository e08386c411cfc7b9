package fun.fengwk.wikitext.cli.batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Batch crawler entry point, see {@code BatchCrawlCommand} for the options.
 *
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.wikitext")
public class CliBatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CliBatchApplication.class, args)));
    }

}
