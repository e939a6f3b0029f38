package com.example.resultsummary;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar result-summary.jar <build|merge> <directory> [config.json]";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 2 || args.length > 3) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
        String command = args[0];
        Path directory = Path.of(args[1]);
        SummaryConfig config = args.length == 3
                ? new ConfigLoader().load(Path.of(args[2]))
                : SummaryConfig.defaults();

        if ("build".equals(command)) {
            new SummaryFileWriter(config).write(directory);
        } else if ("merge".equals(command)) {
            MergeResult result = new SummaryAggregator(config).mergeSummaries(directory);
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(ResultSizeInfo.from(result)));
        } else {
            LOGGER.error("Unknown command '{}'. {}", command, USAGE);
            System.exit(1);
        }
    }
}
