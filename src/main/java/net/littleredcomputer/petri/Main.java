package net.littleredcomputer.petri;

import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import net.littleredcomputer.petri.search.HybridAnalyzer;
import net.littleredcomputer.petri.search.SearchConfig;
import net.littleredcomputer.petri.search.SearchResult;
import net.littleredcomputer.petri.symbolic.SymbolicConfig;
import net.littleredcomputer.petri.symbolic.SymbolicReachability;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.*;

public class Main {
    private static final Splitter.MapSplitter weightSplitter = Splitter.on(',').trimResults().omitEmptyStrings()
            .withKeyValueSeparator(Splitter.on('=').trimResults());

    private static Options options() {
        Options options = new Options()
                .addOption("task", true, "summary, bfs, reachability, deadlock or optimize")
                .addOption("problem", true, "filename of PNML net description (- for stdin)")
                .addOption("target", true, "optimize: place whose marking is to be maximized")
                .addOption("weights", true, "optimize: objective weights as place=weight,...")
                .addOption("order", true, "BDD variable order: sorted (default) or declaration")
                .addOption("list", false, "print every reachable marking")
                .addOption("tiebreak", true, "break objective ties lexicographically (default true)")
                .addOption("timeout", true, "per-solve time limit in seconds (default none)")
                .addOption("maxattempts", true, "give up after this many candidates")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
        options.getOption("task").setRequired(true);
        options.getOption("problem").setRequired(true);
        return options;
    }

    private static PetriNet net(CommandLine cmd) throws IOException {
        String p = cmd.getOptionValue("problem");
        return p.equals("-")
                ? PnmlReader.read(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)))
                : PnmlReader.read(Paths.get(p));
    }

    private static SymbolicConfig symbolicConfig(CommandLine cmd) {
        String order = cmd.getOptionValue("order", "sorted");
        switch (order) {
            case "sorted": return SymbolicConfig.DEFAULT;
            case "declaration": return SymbolicConfig.DEFAULT.withVariableOrder(SymbolicConfig.VariableOrder.DECLARATION);
            default: throw new IllegalArgumentException("unknown variable order: " + order);
        }
    }

    private static long nonNegative(CommandLine cmd, String option, long defaultValue) throws ParseException {
        if (!cmd.hasOption(option)) return defaultValue;
        String v = cmd.getOptionValue(option);
        String problem = String.format("-%s expects a non-negative integer, got '%s'", option, v);
        long n;
        try {
            n = Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new ParseException(problem);
        }
        if (n < 0) throw new ParseException(problem);
        return n;
    }

    private static SearchConfig searchConfig(CommandLine cmd) throws ParseException {
        return SearchConfig.DEFAULT
                .withLexicographicTieBreak(Boolean.parseBoolean(cmd.getOptionValue("tiebreak", "true")))
                .withTimeoutSeconds((int) Math.min(nonNegative(cmd, "timeout", 0), Integer.MAX_VALUE));
    }

    /**
     * Objective weights from -weights or -target. A target that is not a place is reported and
     * dropped, leaving the analyzer to maximize the number of marked places.
     */
    static Map<String, Integer> weights(CommandLine cmd, PetriNet net, PrintStream out) throws ParseException {
        Map<String, Integer> w = new LinkedHashMap<>();
        if (cmd.hasOption("weights")) {
            String text = cmd.getOptionValue("weights");
            try {
                weightSplitter.split(text).forEach((p, v) -> w.put(p, Integer.parseInt(v)));
            } catch (IllegalArgumentException e) {
                throw new ParseException(String.format("-weights expects place=weight,..., got '%s'", text));
            }
        }
        if (cmd.hasOption("target")) {
            String target = cmd.getOptionValue("target");
            if (net.hasPlace(target)) {
                w.put(target, 1);
                out.printf("Target optimization: maximize tokens in '%s'%n", target);
            } else {
                out.printf("Warning: place '%s' not found; optimizing for the number of marked places%n", target);
            }
        }
        if (w.isEmpty()) out.println("No target specified; optimizing for the number of marked places");
        return w;
    }

    private static void printMarkings(PrintStream out, Collection<Marking> ms) {
        int i = 0;
        for (Marking m : ms) out.printf("  %d: %s%n", ++i, m);
    }

    private static Duration logInterval(CommandLine cmd) throws ParseException {
        String v = cmd.getOptionValue("loginterval", "PT1S");
        try {
            return Duration.parse(v);
        } catch (DateTimeParseException e) {
            throw new ParseException(String.format("-loginterval expects an ISO-8601 duration, got '%s'", v));
        }
    }

    /**
     * Run the command line and return the process exit status: 0 on success, 1 if the
     * options or the net are invalid.
     */
    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        try {
            CommandLine cmd = new DefaultParser().parse(options(), args);
            PetriNet net = net(cmd);
            runTask(cmd.getOptionValue("task"), cmd, net, out);
            return 0;
        } catch (ParseException e) {
            err.println("ERROR: " + e.getMessage());
            return 1;
        } catch (InvalidNetException e) {
            err.println("ERROR while reading PNML:");
            e.errors().forEach(err::println);
            return 1;
        }
    }

    private static void runTask(String task, CommandLine cmd, PetriNet net, PrintStream out) throws ParseException {
        Duration logInterval = logInterval(cmd);
        switch (task) {
            case "summary":
                out.println("Petri net parsed successfully!");
                out.print(net.summary());
                break;
            case "bfs": {
                Stopwatch sw = Stopwatch.createStarted();
                SortedSet<Marking> ms = ExplicitReachability.reachableMarkings(net);
                out.printf("Total reachable markings found: %d%n", ms.size());
                out.printf("Time taken: %s%n", sw);
                if (cmd.hasOption("list")) printMarkings(out, ms);
                break;
            }
            case "reachability": {
                Stopwatch sw = Stopwatch.createStarted();
                SymbolicReachability s = new SymbolicReachability(net, symbolicConfig(cmd));
                int r = s.computeReachable();
                out.printf("Total reachable markings: %s%n", s.count(r));
                out.printf("Iterations: %d%n", s.iterations());
                out.printf("BDD nodes: %d%n", s.manager().size(r));
                out.printf("Time taken: %s%n", sw);
                if (cmd.hasOption("list")) printMarkings(out, s.markings(r));
                break;
            }
            case "deadlock": {
                HybridAnalyzer h = analyzer(cmd, net).setLogInterval(logInterval);
                Optional<SearchResult> result = h.findDeadlock();
                if (result.isPresent()) {
                    out.printf("DEADLOCK FOUND at attempt %d%n", result.get().attempts());
                    out.printf("Marking: %s%n", result.get().marking());
                    out.printf("Time taken: %s%n", result.get().elapsed());
                } else {
                    out.println("NO DEADLOCK.");
                }
                break;
            }
            case "optimize": {
                Map<String, Integer> w = weights(cmd, net, out);
                HybridAnalyzer h = analyzer(cmd, net).setLogInterval(logInterval);
                Optional<SearchResult> result = h.optimize(w);
                if (result.isPresent()) {
                    out.printf("OPTIMAL MARKING FOUND at attempt %d%n", result.get().attempts());
                    out.printf("Marking: %s%n", result.get().marking());
                    out.printf("Total objective value: %d%n", result.get().objectiveValue());
                    out.printf("Time taken: %s%n", result.get().elapsed());
                } else {
                    out.println("No reachable marking found.");
                }
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }

    private static HybridAnalyzer analyzer(CommandLine cmd, PetriNet net) throws ParseException {
        HybridAnalyzer h = new HybridAnalyzer(net, symbolicConfig(cmd), searchConfig(cmd));
        if (cmd.hasOption("maxattempts")) {
            long n = nonNegative(cmd, "maxattempts", 0);
            if (n == 0) throw new ParseException("-maxattempts must be positive");
            h.setMaxAttempts(n);
        }
        return h;
    }

    public static void main(String[] args) throws IOException {
        int status = run(args, System.out, System.err);
        if (status != 0) System.exit(status);
    }
}
