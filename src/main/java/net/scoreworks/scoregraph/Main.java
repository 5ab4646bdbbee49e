/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph;

import net.scoreworks.scoregraph.config.ScoreGraphConfig;
import net.scoreworks.scoregraph.document.GraphDocument;
import net.scoreworks.scoregraph.document.JsonLdParser;
import net.scoreworks.scoregraph.document.TurtleWriter;
import net.scoreworks.scoregraph.exceptions.ConfigurationLoadException;
import net.scoreworks.scoregraph.exceptions.GraphDocumentException;
import net.scoreworks.scoregraph.exceptions.MissingStructureException;
import net.scoreworks.scoregraph.identity.PositionalIds;
import net.scoreworks.scoregraph.score.MusicXmlReader;
import net.scoreworks.scoregraph.score.ScorePartwise;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;


/**
 * Command line entry point.
 * <pre>
 * Main &lt;score.xml|dir&gt; [--in doc.jsonld|dir] [--out doc.jsonld|dir] [--ttl file.ttl|dir] [--config file.properties]
 * </pre>
 * Without {@code --out} the document is written next to the score as {@code <name>.jsonld}. Without {@code --in}
 * the output document is read first, so running twice merges into the same graph. For a directory every
 * {@code .xml} and {@code .musicxml} file is processed and the options name directories.
 */
public final class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FAILURE = 2;

    static final String USAGE = "usage: scoregraph <score.xml|dir> [--in doc.jsonld|dir] [--out doc.jsonld|dir] "
            + "[--ttl file.ttl|dir] [--config file.properties]";

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * @return the exit code
     */
    public static int run(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        ScoreGraphConfig config;
        try {
            config = ScoreGraphConfig.load(options.config);
        } catch (ConfigurationLoadException e) {
            LOG.error("Can't load configuration", e);
            return EXIT_USAGE;
        }

        List<Path> scores;
        boolean batch = Files.isDirectory(options.score);
        try {
            scores = batch ? listScores(options.score) : List.of(options.score);
        } catch (IOException e) {
            LOG.error("Can't list {}", options.score, e);
            return EXIT_FAILURE;
        }
        if (scores.isEmpty()) {
            LOG.warn("No MusicXML file in {}", options.score);
            return EXIT_OK;
        }

        ScoreGraphPipeline pipeline = ScoreGraphPipeline.defaultPipeline(config);
        MusicXmlReader reader = new MusicXmlReader();
        int failures = 0;
        for (Path score : scores) {
            try {
                process(score, batch, options, config, pipeline, reader);
            } catch (IOException | MissingStructureException | GraphDocumentException e) {
                //one broken score must not stop a batch
                LOG.error("Failed to process {}", score, e);
                failures++;
            }
        }
        if (failures > 0) {
            LOG.error("{} of {} score(s) failed", failures, scores.size());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private static void process(Path scorePath, boolean batch, Options options, ScoreGraphConfig config,
                                ScoreGraphPipeline pipeline, MusicXmlReader reader) throws IOException {
        ScorePartwise score = reader.read(scorePath);
        String baseName = PositionalIds.workLocalIdOf(scorePath.getFileName().toString());
        Path out = target(options.out, batch, scorePath, baseName + ".jsonld");
        Path in = options.in == null ? out : target(options.in, batch, scorePath, baseName + ".jsonld");

        GraphDocument document = JsonLdParser.read(in);
        ScoreContext context = new ScoreContext(score, config);
        pipeline.run(context, document.getStore());

        JsonLdParser.write(document, out, config.isPrettyPrint());
        LOG.info("{} -> {} ({} nodes)", scorePath.getFileName(), out, document.getStore().size());
        if (options.ttl != null) {
            Path ttl = target(options.ttl, batch, scorePath, baseName + ".ttl");
            TurtleWriter.write(document, ttl);
            LOG.info("{} -> {}", scorePath.getFileName(), ttl);
        }
    }

    /**
     * @return the file an option names. Directories, and every option in batch mode, get the file name appended.
     * Without option the file lies next to the score
     */
    static Path target(@Nullable Path option, boolean batch, Path score, String fileName) {
        if (option == null) {
            Path parent = score.toAbsolutePath().getParent();
            return parent == null ? Path.of(fileName) : parent.resolve(fileName);
        }
        if (batch || Files.isDirectory(option))
            return option.resolve(fileName);
        return option;
    }

    static List<Path> listScores(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> StringUtils.endsWithAny(p.getFileName().toString().toLowerCase(), ".xml", ".musicxml"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }


    static final class Options {
        Path score;
        @Nullable Path in;
        @Nullable Path out;
        @Nullable Path ttl;
        @Nullable Path config;

        /**
         * @throws IllegalArgumentException with a message for the user if the arguments are unusable
         */
        static Options parse(String[] args) {
            Options options = new Options();
            List<String> positional = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    positional.add(arg);
                    continue;
                }
                if (i + 1 >= args.length)
                    throw new IllegalArgumentException("missing value for " + arg);
                Path value = Path.of(args[++i]);
                switch (arg) {
                    case "--in": options.in = value; break;
                    case "--out": options.out = value; break;
                    case "--ttl": options.ttl = value; break;
                    case "--config": options.config = value; break;
                    default: throw new IllegalArgumentException("unknown option " + arg);
                }
            }
            if (positional.size() != 1)
                throw new IllegalArgumentException("expected exactly one score file or directory");
            options.score = Path.of(positional.get(0));
            if (!Files.exists(options.score))
                throw new IllegalArgumentException(options.score + " does not exist");
            return options;
        }
    }
}
