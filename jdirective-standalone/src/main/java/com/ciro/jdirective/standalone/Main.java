package com.ciro.jdirective.standalone;

import com.ciro.jdirective.ObjectMapperFactory;
import com.ciro.jdirective.ParserOption;
import com.ciro.jdirective.RenderResult;
import com.ciro.jdirective.error.TemplateException;
import com.ciro.jdirective.runtime.EngineConfig;
import com.ciro.jdirective.runtime.TemplateEngine;
import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Render por línea de comandos: la salida va a stdout y los errores acumulados a stderr.
 *
 * <pre>
 * Main &lt;template.html&gt; [data.json] [--request|--preview|--editor|--component|--debug]
 *      [--locale &lt;nombre&gt;] [--locales &lt;dir&gt;] [--components &lt;dir&gt;]
 * </pre>
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    static final String USAGE_TEXT = "Usage: jdirective <template.html> [data.json] "
        + "[--request|--preview|--editor|--component|--debug] "
        + "[--locale <name>] [--locales <dir>] [--components <dir>]";

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != OK) System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path template = null;
        Path dataFile = null;
        String localeName = null;
        ParserOption option = ParserOption.defaults();
        EngineConfig config = EngineConfig.load();

        // 1. Argumentos
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--request" -> option.setRequest(true);
                case "--preview" -> option.setPreview(true);
                case "--editor" -> option.setEditor(true);
                case "--component" -> option.setComponent(true);
                case "--debug" -> option.setDebug(true);
                case "--locale", "--locales", "--components" -> {
                    if (i + 1 >= args.length) {
                        err.println("Missing value for " + arg);
                        err.println(USAGE_TEXT);
                        return USAGE;
                    }
                    String value = args[++i];
                    if (arg.equals("--locale")) localeName = value;
                    else if (arg.equals("--locales")) config.setLocaleRoot(value);
                    else config.setComponentRoot(value);
                }
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("Unknown option " + arg);
                        err.println(USAGE_TEXT);
                        return USAGE;
                    }
                    if (template == null) template = Paths.get(arg);
                    else if (dataFile == null) dataFile = Paths.get(arg);
                    else {
                        err.println("Unexpected argument " + arg);
                        err.println(USAGE_TEXT);
                        return USAGE;
                    }
                }
            }
        }
        if (template == null) {
            err.println(USAGE_TEXT);
            return USAGE;
        }

        // 2. Render
        try {
            String html = Files.readString(template);
            Map<String, Object> data = dataFile == null ? new LinkedHashMap<>() : readData(dataFile);

            TemplateEngine engine = new TemplateEngine(config);
            if (localeName != null) {
                String name = localeName;
                option.setLocale(engine.locales().find(name, option.cacheDisabled())
                    .orElseThrow(() -> new IllegalArgumentException("Locale not found: " + name)));
            }
            option.setRoute(template.getFileName().toString());

            RenderResult result = engine.render(html, data, option);
            out.print(result.html());
            out.flush();

            for (TemplateException e : result.errors()) {
                err.println("error [" + e.category() + "] " + e.getMessage());
            }
            return OK;
        } catch (IOException e) {
            log.debug("I/O failure", e);
            err.println("Cannot read input: " + e.getMessage());
            return FAILED;
        } catch (TemplateException | IllegalArgumentException e) {
            log.debug("Render failed", e);
            err.println("Render failed: " + e.getMessage());
            return FAILED;
        }
    }

    private static Map<String, Object> readData(Path file) throws IOException {
        return ObjectMapperFactory.shared().readValue(file.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {});
    }
}
