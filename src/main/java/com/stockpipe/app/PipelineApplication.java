package com.stockpipe.app;

import com.stockpipe.collect.CollectionResult;
import com.stockpipe.collect.NewsCollector;
import com.stockpipe.collect.PriceCollector;
import com.stockpipe.collect.RelevanceFilter;
import com.stockpipe.collect.RetryPolicy;
import com.stockpipe.collect.Sleeper;
import com.stockpipe.collect.SlidingWindowRateLimiter;
import com.stockpipe.config.Config;
import com.stockpipe.config.PipelineSettings;
import com.stockpipe.data.FinnhubNewsSource;
import com.stockpipe.data.StooqPriceSource;
import com.stockpipe.data.http.HttpClientEx;
import com.stockpipe.dataset.DatasetSplitter;
import com.stockpipe.dataset.LabelGenerator;
import com.stockpipe.dataset.NewsDatasetBuilder;
import com.stockpipe.dataset.NewsDatasetRow;
import com.stockpipe.dataset.SplitRatios;
import com.stockpipe.dataset.SplitSnapshotWriter;
import com.stockpipe.db.Database;
import com.stockpipe.db.LabelDao;
import com.stockpipe.db.MigrationRunner;
import com.stockpipe.db.NewsArticleDao;
import com.stockpipe.db.PriceBarDao;
import com.stockpipe.db.RunLogDao;
import com.stockpipe.feature.SequenceDatasetWriter;
import com.stockpipe.feature.SequenceGenerator;
import com.stockpipe.feature.TechnicalIndicatorEngine;
import com.stockpipe.model.IndicatorRow;
import com.stockpipe.model.Label;
import com.stockpipe.model.NewsArticle;
import com.stockpipe.model.RunRecord;
import com.stockpipe.model.SequenceSample;
import com.stockpipe.model.SplitAssignment;
import com.stockpipe.time.CutoffRule;
import com.stockpipe.time.Standardizer;
import com.stockpipe.time.UsEquityCalendar;
import com.stockpipe.validate.NewsDataValidator;
import com.stockpipe.validate.PriceDataValidator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line entry point. Stages run in pipeline order regardless of flag order:
 * init-db, collect-prices, collect-news, validate, labels, split, features, news-dataset.
 */
public final class PipelineApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private static final List<String> STAGES = List.of(
            "init-db", "collect-prices", "collect-news", "validate", "labels", "split", "features", "news-dataset");
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new PipelineApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("stockpipe", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("stockpipe", options);
            return EXIT_OK;
        }

        Set<String> stages = selectedStages(cmd);
        if (stages.isEmpty() && !cmd.hasOption("recent-runs")) {
            new HelpFormatter().printHelp("stockpipe", options);
            System.err.println("ERROR: no stage selected.");
            return EXIT_USAGE;
        }
        Integer days = null;
        if (cmd.hasOption("days")) {
            days = parsePositiveInt(cmd.getOptionValue("days"));
            if (days == null) {
                System.err.println("ERROR: --days must be a positive integer.");
                return EXIT_USAGE;
            }
        }
        Integer recentRuns = null;
        if (cmd.hasOption("recent-runs")) {
            recentRuns = parsePositiveInt(cmd.getOptionValue("recent-runs", "10"));
            if (recentRuns == null) {
                System.err.println("ERROR: --recent-runs must be a positive integer.");
                return EXIT_USAGE;
            }
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            PipelineSettings settings = PipelineSettings.fromConfig(config);
            System.out.println("config sources tickers=" + config.sourceOf("tickers")
                    + " db.url=" + config.sourceOf("db.url")
                    + " outputs.dir=" + config.sourceOf("outputs.dir"));
            List<String> tickers = cmd.hasOption("tickers")
                    ? parseTickers(cmd.getOptionValue("tickers"))
                    : settings.getTickers();
            if (tickers.isEmpty()) {
                System.err.println("ERROR: no tickers configured (config tickers or --tickers).");
                return EXIT_USAGE;
            }

            Database database = Database.fromConfig(config, System.getenv());
            System.out.println("DB " + database.describe());
            new MigrationRunner().run(database);

            Stages runner = new Stages(config, settings, database, tickers, days == null ? settings.getDefaultDays() : days);
            boolean ok = true;
            for (String stage : STAGES) {
                if (stages.contains(stage)) {
                    ok &= runner.run(stage);
                }
            }
            if (recentRuns != null) {
                System.out.println(new RunLogDao(database).summarizeRecentRuns(recentRuns));
            }
            return ok ? EXIT_OK : EXIT_FATAL;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return EXIT_FATAL;
        }
    }

    static Set<String> selectedStages(CommandLine cmd) {
        Set<String> out = new LinkedHashSet<>();
        if (cmd.hasOption("all")) {
            out.addAll(STAGES);
            return out;
        }
        for (String stage : STAGES) {
            if (cmd.hasOption(stage)) {
                out.add(stage);
            }
        }
        return out;
    }

    static List<String> parseTickers(String raw) {
        Set<String> out = new LinkedHashSet<>();
        if (raw != null) {
            for (String token : raw.split("[,;\\s]+")) {
                String t = token.trim().toUpperCase(Locale.ROOT);
                if (!t.isEmpty()) {
                    out.add(t);
                }
            }
        }
        return new ArrayList<>(out);
    }

    static Integer parsePositiveInt(String raw) {
        try {
            int value = Integer.parseInt(raw == null ? "" : raw.trim());
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (PipelineApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("stockpipe.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(PipelineApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("init-db").desc("create tables and indexes if missing").build());
        options.addOption(Option.builder().longOpt("collect-prices").desc("fetch daily bars for the tickers").build());
        options.addOption(Option.builder().longOpt("collect-news").desc("fetch company news for the tickers").build());
        options.addOption(Option.builder().longOpt("validate").desc("run price and news quality checks").build());
        options.addOption(Option.builder().longOpt("labels").desc("derive next-session labels from stored closes").build());
        options.addOption(Option.builder().longOpt("split").desc("chronological train/val/test split of labeled dates").build());
        options.addOption(Option.builder().longOpt("features").desc("compute indicators and write labeled sequences").build());
        options.addOption(Option.builder().longOpt("news-dataset").desc("group headlines by prediction date and write JSON lines").build());
        options.addOption(Option.builder().longOpt("all").desc("run every stage in order").build());
        options.addOption(Option.builder().longOpt("tickers").hasArg().argName("list").desc("comma-separated tickers, overrides config").build());
        options.addOption(Option.builder().longOpt("days").hasArg().argName("n").desc("collection lookback in calendar days").build());
        options.addOption(Option.builder().longOpt("recent-runs").hasArg().optionalArg(true).argName("n").desc("print the most recent run log entries").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    /**
     * Stage wiring over one database. Each stage returns false when it ran but did not succeed.
     */
    private static final class Stages {
        private final Config config;
        private final PipelineSettings settings;
        private final List<String> tickers;
        private final int days;
        private final PriceBarDao priceDao;
        private final NewsArticleDao newsDao;
        private final LabelDao labelDao;
        private final RunLogDao runLogDao;
        private final UsEquityCalendar calendar;
        private final Clock clock = Clock.systemUTC();

        Stages(Config config, PipelineSettings settings, Database database, List<String> tickers, int days) {
            this.config = config;
            this.settings = settings;
            this.tickers = tickers;
            this.days = days;
            this.priceDao = new PriceBarDao(database);
            this.newsDao = new NewsArticleDao(database);
            this.labelDao = new LabelDao(database);
            this.runLogDao = new RunLogDao(database);
            this.calendar = new UsEquityCalendar(settings.getExtraClosures(), settings.getSearchHorizonDays());
        }

        boolean run(String stage) throws Exception {
            switch (stage) {
                case "init-db":
                    return true;
                case "collect-prices":
                    return collectPrices();
                case "collect-news":
                    return collectNews();
                case "validate":
                    return validate();
                case "labels":
                    new LabelGenerator(priceDao, labelDao).generate(tickers);
                    return true;
                case "split":
                    return split();
                case "features":
                    return features();
                case "news-dataset":
                    return newsDataset();
                default:
                    throw new IllegalArgumentException("unknown stage: " + stage);
            }
        }

        private RetryPolicy retryPolicy() {
            return new RetryPolicy(settings.getRetryMaxAttempts(), settings.getRetryBaseDelayMs(), Sleeper.THREAD);
        }

        private boolean collectPrices() {
            PriceCollector collector = new PriceCollector(
                    new StooqPriceSource(config, new HttpClientEx()),
                    priceDao,
                    runLogDao,
                    retryPolicy(),
                    clock,
                    settings.getMarketZone()
            );
            return reportCollection(collector.collect(new LinkedHashSet<>(tickers), days));
        }

        private boolean collectNews() {
            NewsCollector collector = new NewsCollector(
                    new FinnhubNewsSource(config, new HttpClientEx()),
                    newsDao,
                    runLogDao,
                    retryPolicy(),
                    new SlidingWindowRateLimiter(settings.getRateLimitMaxCalls(), settings.getRateLimitWindowMs()),
                    new RelevanceFilter(settings.getCompanyNames(), settings.getRelevanceMinRetentionRatio()),
                    new Standardizer(settings.getMarketZone()),
                    clock
            );
            return reportCollection(collector.collect(new LinkedHashSet<>(tickers), days));
        }

        private boolean reportCollection(CollectionResult result) {
            for (Map.Entry<String, String> e : result.errors().entrySet()) {
                System.err.println("WARN: ticker failed ticker=" + e.getKey() + " error=" + e.getValue());
            }
            return !RunRecord.STATUS_FAILED.equals(result.status()) && result.isRunLogged();
        }

        private boolean validate() throws Exception {
            PriceDataValidator.Report prices = new PriceDataValidator(priceDao, calendar, settings.getPriceJumpThreshold())
                    .validate(tickers);
            NewsDataValidator.Report news = new NewsDataValidator(
                    newsDao, settings.getNewsMinArticles(), settings.getNewsFutureBufferMinutes(), clock)
                    .validate(tickers);
            if (!prices.passed() || !news.passed()) {
                System.err.println("WARN: validation issues price_passed=" + prices.passed() + " news_passed=" + news.passed());
            }
            return true;
        }

        private boolean split() throws Exception {
            List<Label> labels = new ArrayList<>();
            for (String ticker : tickers) {
                labels.addAll(labelDao.loadLabels(ticker));
            }
            DatasetSplitter splitter = new DatasetSplitter(
                    SplitRatios.of(settings.getTrainRatio(), settings.getValRatio()), settings.getMinSplitDates());
            SplitAssignment assignment = splitter.splitLabels(labels);
            new SplitSnapshotWriter(settings.getOutputsDir()).save(assignment);
            return true;
        }

        private boolean features() throws Exception {
            TechnicalIndicatorEngine engine = new TechnicalIndicatorEngine();
            SequenceGenerator generator = new SequenceGenerator(calendar, settings.getSequenceWindow());
            List<SequenceSample> all = new ArrayList<>();
            int totalRows = 0;
            for (String ticker : tickers) {
                List<IndicatorRow> rows = engine.compute(ticker, priceDao.loadSeries(ticker));
                Map<LocalDate, Label> labels = new LinkedHashMap<>();
                for (Label label : labelDao.loadLabels(ticker)) {
                    labels.put(label.date, label);
                }
                List<SequenceSample> samples = generator.generate(ticker, rows, labels);
                totalRows += rows.size();
                all.addAll(samples);
                System.out.println("features ticker=" + ticker + " indicator_rows=" + rows.size() + " sequences=" + samples.size());
            }
            new SequenceDatasetWriter(settings.getOutputsDir()).write(all);
            System.out.println("features done tickers=" + tickers.size() + " indicator_rows=" + totalRows + " sequences=" + all.size());
            return true;
        }

        private boolean newsDataset() throws Exception {
            Map<String, Label> labels = new LinkedHashMap<>();
            for (String ticker : tickers) {
                for (Label label : labelDao.loadLabels(ticker)) {
                    labels.put(label.key(), label);
                }
            }
            List<NewsArticle> articles = new ArrayList<>();
            for (String ticker : tickers) {
                articles.addAll(newsDao.loadByTicker(ticker));
            }
            NewsDatasetBuilder builder = new NewsDatasetBuilder(
                    new CutoffRule(calendar, settings.getCutoff(), settings.getMarketZone()));
            List<NewsDatasetRow> rows = builder.build(articles, labels, true);
            Path target = NewsDatasetBuilder.writeJsonLines(
                    settings.getOutputsDir().resolve("datasets").resolve("news_dataset.jsonl"), rows);
            System.out.println("news dataset saved path=" + target.toAbsolutePath() + " rows=" + rows.size());
            return true;
        }
    }
}
