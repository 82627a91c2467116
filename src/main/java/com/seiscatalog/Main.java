package com.seiscatalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seiscatalog.filter.CriteriaParser;
import com.seiscatalog.filter.FilterCriteria;
import com.seiscatalog.models.CatalogRecord;
import com.seiscatalog.models.VirtualArray;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Command-line front end: match, optionally filter, then group or organize,
 * and print the result as one JSON document on stdout.
 */
public class Main {

    private static final String VERSION = "1.0.0";

    public static void main(String[] args) {
        AppConfig config;
        try {
            config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();
        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(AppConfig.usage());
            System.exit(1);
            return;
        }
        if (config.isHelp()) {
            System.out.println(AppConfig.usage());
            return;
        }

        try {
            AppLogger.initialize(config.getLogPath(), true, config.isVerbose());
        } catch (IOException e) {
            System.err.println("Failed to open log file " + config.getLogPath() + ": " + e.getMessage());
            System.exit(1);
            return;
        }
        AppLogger logger = AppLogger.get();
        logger.info("SeisCatalog v" + VERSION);

        int status = run(config, System.out);
        logger.close();
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return the process exit status
     */
    public static int run(AppConfig config, PrintStream out) {
        AppLogger logger = AppLogger.get();
        ObjectMapper objectMapper = createObjectMapper();
        try {
            SeisCatalog.Builder builder = SeisCatalog.builder(config.getRootDir().toString(), config.getTemplate());
            if (config.isResponseProfile()) {
                builder.responseProfile();
            }
            SeisCatalog catalog = builder
                    .customFields(config.getCustomFields())
                    .overwrite(config.isOverwrite())
                    .build();

            catalog.match(config.getThreads());

            ObjectNode result = objectMapper.createObjectNode();
            result.put("root", catalog.getRootDir().toString());
            result.put("pattern", catalog.getPattern().pattern());
            result.put("matched", catalog.getRecords().size());

            List<CatalogRecord> selected = catalog.getRecords();
            if (config.getCriteriaFile() != null) {
                FilterCriteria criteria = new CriteriaParser(objectMapper).parseFile(config.getCriteriaFile());
                selected = catalog.filter(criteria, config.getThreads(), config.isVerbose());
                result.put("filtered", selected.size());
            }

            if (!config.getGroupLabels().isEmpty()) {
                Map<Object, List<CatalogRecord>> groups = catalog.group(
                        config.getGroupLabels(), config.getSortLabels(), config.isUseFiltered());
                ArrayNode groupsNode = result.putArray("groups");
                for (Map.Entry<Object, List<CatalogRecord>> entry : groups.entrySet()) {
                    ObjectNode groupNode = groupsNode.addObject();
                    groupNode.set("key", objectMapper.valueToTree(entry.getKey()));
                    groupNode.set("files", objectMapper.valueToTree(entry.getValue()));
                }
            } else if (!config.getOrganizeLabels().isEmpty()) {
                VirtualArray array = catalog.organize(
                        config.getOrganizeLabels(), config.getOutputType(), config.isUseFiltered());
                result.set("virtual_array", objectMapper.valueToTree(array));
            } else {
                result.set("files", objectMapper.valueToTree(selected));
            }

            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            return 0;
        } catch (ConfigurationException e) {
            logger.error("Configuration error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Failed to write result: " + e.getMessage(), e);
            return 2;
        }
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return objectMapper;
    }
}
