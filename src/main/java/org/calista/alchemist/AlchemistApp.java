package org.calista.alchemist;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.alchemist.core.AlchemistKernel;
import org.calista.alchemist.dictionary.DictionaryGenerator;
import org.calista.alchemist.expr.ExpressionSyntaxException;
import org.calista.alchemist.number.ArithmeticDomainException;
import org.calista.alchemist.prove.ProofException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * AlchemistApp — console runner.
 *
 * <pre>
 *   AlchemistApp &lt;base&gt; &lt;target&gt;...   batch: prove every target, exit code 1 if any failed
 *   AlchemistApp                      interactive loop
 * </pre>
 *
 * Interactive commands: {@code :base <digits>}, {@code :steps}, {@code :save}, {@code :size}, {@code exit};
 * anything else is a target expression.
 */
public final class AlchemistApp {

    private static final Logger log = LogManager.getLogger(AlchemistApp.class);

    private final Path configRoot;
    private final Path cfgPath;
    private final PrintStream out;

    private AlchemistKernel kernel;
    private String base;
    private boolean printSteps;

    public static void main(String[] args) throws Exception {
        int failed = new AlchemistApp().run(args);
        if (failed > 0) System.exit(1);
    }

    public AlchemistApp() {
        this(Path.of("."), Path.of("config/alchemist.json"), System.out);
    }

    public AlchemistApp(Path configRoot, Path cfgPath, PrintStream out) {
        this.configRoot = configRoot;
        this.cfgPath = cfgPath;
        this.out = out;
    }

    /**
     * @return number of failed targets (batch mode); 0 for the interactive loop
     */
    public int run(String[] args) throws IOException {
        try {
            kernel = AlchemistKernel.builder()
                    .configRoot(configRoot)
                    .build(cfgPath);
            base = kernel.config().console.defaultBase;
            printSteps = kernel.config().console.printSteps;

            if (args != null && args.length > 0) {
                return runBatch(args[0], Arrays.asList(args).subList(1, args.length));
            }
            runConsoleLoop();
            return 0;
        } finally {
            if (kernel != null) kernel.close();
        }
    }

    int runBatch(String batchBase, List<String> targets) throws IOException {
        base = batchBase;
        int failed = 0;
        for (String t : targets) {
            if (!proveAndPrint(t)) failed++;
        }
        return failed;
    }

    private void runConsoleLoop() throws IOException {
        log.info("Alchemist started. base={}", base);
        out.println("Base " + base + ". Type a target expression, ':base <digits>', ':steps', ':save', ':size' or 'exit'.");

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) break;
            if (!handleLine(line)) break;
        }
        out.println("Bye.");
    }

    /**
     * @return false when the loop should stop
     */
    boolean handleLine(String raw) throws IOException {
        String line = raw.trim();
        if (line.isEmpty()) return true;
        if (line.equalsIgnoreCase("exit")) return false;

        if (line.startsWith(":base")) {
            String next = DictionaryGenerator.digitsOf(line.substring(5));
            if (next.isEmpty()) {
                out.println("Usage: :base <digits>");
            } else {
                base = next;
                out.println("Base " + base + " (" + kernel.engine(base).dictionary().size() + " entries)");
            }
            return true;
        }
        switch (line) {
            case ":steps" -> {
                printSteps = !printSteps;
                out.println("Steps " + (printSteps ? "on" : "off"));
            }
            case ":save" -> out.println("Saved " + kernel.saveSnapshots() + " snapshot(s)");
            case ":size" -> out.println(kernel.engine(base).dictionary().size() + " entries for base " + base);
            default -> proveAndPrint(line);
        }
        return true;
    }

    private boolean proveAndPrint(String target) throws IOException {
        try {
            AlchemistKernel.Proof p = kernel.prove(base, target, null);
            out.println(p.target + " = " + p.expression);
            if (printSteps) out.println(p.steps);
            return true;
        } catch (ProofException | ExpressionSyntaxException | ArithmeticDomainException e) {
            log.debug("Target '{}' failed", target, e);
            out.println("Error: " + e.getMessage());
            return false;
        }
    }

    public AlchemistKernel getKernel() { return kernel; }

    public String getBase() { return base; }
}
