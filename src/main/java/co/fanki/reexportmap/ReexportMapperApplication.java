package co.fanki.reexportmap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Re-export Mapper Application.
 *
 * <p>Scans the public entry points of a downstream Python package and
 * writes a JSON report of every public name it re-exports from an
 * upstream core package, with the module that originally defines it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ReexportMapperApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments, e.g.
     *        {@code --reexport.downstream.root=/path/to/site-packages}
     */
    public static void main(final String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(ReexportMapperApplication.class, args)));
    }

}
