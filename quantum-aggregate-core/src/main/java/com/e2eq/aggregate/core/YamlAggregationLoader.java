package com.e2eq.aggregate.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads aggregation definitions from a YAML file or classpath resource.
 * The YAML lists aggregations, each with its grouping keys and an optional nested child level.
 */
public final class YamlAggregationLoader {

    // DTOs mirroring YAML
    public record YAggregations(Integer version, List<YAggregation> aggregations) {}
    public record YAggregation(
            String id,
            String filter,
            List<String> groupBy,
            // name of a mapper in the ValueMapperRegistry
            String mapValue,
            YAggregation child
    ) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final ValueMapperRegistry mappers;

    public YamlAggregationLoader(ValueMapperRegistry mappers) {
        this.mappers = Objects.requireNonNull(mappers, "mappers");
    }

    public List<AggregationDefinition> loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toDefinitions(mapper.readValue(in, YAggregations.class));
        }
    }

    public List<AggregationDefinition> loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toDefinitions(mapper.readValue(in, YAggregations.class));
        }
    }

    public List<AggregationDefinition> load(InputStream in) throws IOException {
        return toDefinitions(mapper.readValue(in, YAggregations.class));
    }

    private List<AggregationDefinition> toDefinitions(YAggregations y) {
        if (y == null) return List.of();
        List<AggregationDefinition> out = new ArrayList<>();
        for (YAggregation a : Optional.ofNullable(y.aggregations()).orElse(List.of())) {
            out.add(toDefinition(a));
        }
        AggregationDefinitionValidator.validate(out, mappers);
        return out;
    }

    private static AggregationDefinition toDefinition(YAggregation a) {
        return new AggregationDefinition(
                a.id(),
                Optional.ofNullable(a.filter()),
                Optional.ofNullable(a.groupBy()).orElse(List.of()),
                Optional.ofNullable(a.mapValue()).filter(s -> !s.isBlank()),
                Optional.ofNullable(a.child()).map(YamlAggregationLoader::toDefinition));
    }
}
