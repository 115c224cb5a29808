package io.hintlite.cli;

import io.hintlite.cli.format.HintFormatter;
import io.hintlite.core.Alphabet;
import io.hintlite.core.HintSession;
import io.hintlite.core.LabelAssigner;
import io.hintlite.core.ReductionEngine;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * Command-line front end: reads targets on stdin, writes hints or the result
 * of typed keys on stdout.
 *
 * Usage:
 *   hintlite [options] generate
 *   hintlite [options] --typed <keys> reduce
 *   hintlite init
 *
 * Examples:
 *   printf '1.1 4.7 9.2,9.5' | hintlite --keys abcd generate
 *   printf '1.1 4.7 9.2,9.5' | hintlite --keys abcd --typed b reduce
 *
 * Nothing is kept between invocations: {@code reduce} rebuilds the hints from
 * the same targets and replays every key typed so far.
 */
public final class Cli {
    private static final Logger log = Logger.getLogger(Cli.class.getName());

    private final CliConfig cfg;
    private final HintFormatter formatter;
    private final PrintStream out;

    Cli(CliConfig cfg, PrintStream out) {
        this.cfg = cfg;
        this.formatter = cfg.format().formatter(new GraphemeTruncator(cfg.maxWidth()));
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Run one invocation. Log records from this package go to {@code err}
     * while the invocation runs.
     *
     * @return process exit status: 0 on success, 1 for usage or configuration
     *         errors, 2 for anything unexpected
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Handler logHandler = null;
        try {
            CliConfig cfg = CliConfig.fromArgs(args);
            if (cfg.help()) {
                out.print(CliConfig.usage());
                return 0;
            }
            logHandler = LogSetup.configure(cfg.verbose(), err);
            new Cli(cfg, out).execute(in);
            out.flush();
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        } finally {
            LogSetup.detach(logHandler);
        }
    }

    void execute(InputStream in) throws IOException {
        switch (cfg.command()) {
            case INIT -> out.print(InitScript.text());
            case GENERATE -> generate(readTargets(in));
            case REDUCE -> reduce(readTargets(in));
        }
    }

    private List<Selection> readTargets(InputStream in) throws IOException {
        List<Selection> targets = TargetReader.read(new InputStreamReader(in, StandardCharsets.UTF_8));
        log.fine(() -> "read " + targets.size() + " targets");
        return targets;
    }

    private void generate(List<Selection> targets) {
        var assigner = new LabelAssigner(Alphabet.of(cfg.keys()));
        // the hints printed here must stay selectable by a later reduce
        new ReductionEngine(cfg.abortSymbol()).requireDistinctFrom(assigner.alphabet());
        out.print(formatter.hints(assigner.assign(targets)));
    }

    private void reduce(List<Selection> targets) {
        var assigner = new LabelAssigner(Alphabet.of(cfg.keys()));
        var engine = new ReductionEngine(cfg.abortSymbol());

        HintSession<Selection> session = HintSession.start(assigner, engine, targets);
        List<Integer> typed = cfg.typed();
        for (int i = 0; i < typed.size(); i++) {
            if (session.isTerminal()) {
                log.warning("session ended after " + i + " keys, ignoring " + (typed.size() - i) + " more");
                break;
            }
            session = session.advance(typed.get(i));
        }
        out.print(render(session));
    }

    private String render(HintSession<Selection> session) {
        if (session instanceof HintSession.Active<Selection> active) {
            return formatter.hints(active.candidates());
        } else if (session instanceof HintSession.Resolved<Selection> resolved) {
            log.fine(() -> "resolved to " + resolved.target().describe());
            return formatter.resolved(resolved.target());
        } else if (session instanceof HintSession.Cancelled) {
            return formatter.cancelled();
        } else {
            return formatter.noMatch();
        }
    }
}
