package com.verso.database.migration;

import com.verso.database.ConnectionSource;
import com.verso.database.SqlScriptVersion;
import com.verso.versioner.Version;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

/**
 * Discovers {@link SqlScriptVersion}s in a resource location.
 *
 * <p>Scripts follow Flyway-style naming:
 *
 * <ul>
 *   <li>{@code V{n}__{description}.sql}: upgrade to version {@code n}
 *   <li>{@code U{n}__{description}.sql}: undo of version {@code n} (optional)
 * </ul>
 *
 * <p>Other files in the location are ignored. Two upgrade (or two undo) scripts for the same
 * number, an undo script without its upgrade, or a number beyond {@code int} fail the load.
 */
public final class ClasspathScriptVersions {

    private static final Logger log = LoggerFactory.getLogger(ClasspathScriptVersions.class);

    private static final Pattern SCRIPT_NAME = Pattern.compile("([VU])(\\d+)__(.+)\\.sql");

    private ClasspathScriptVersions() {}

    /**
     * Loads the scripts under {@code location}.
     *
     * @param location Spring resource location (e.g. {@code classpath:db/versions})
     * @param connections where the scripts will run
     * @return the versions found, ascending by number
     * @throws IllegalStateException if the scripts are inconsistent
     * @throws UncheckedIOException if the location cannot be scanned
     */
    public static List<Version> load(String location, ConnectionSource connections) {
        return load(new PathMatchingResourcePatternResolver(), location, connections);
    }

    static List<Version> load(
            ResourcePatternResolver resolver, String location, ConnectionSource connections) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location must not be null or blank");
        }
        Resource[] resources;
        try {
            resources = resolver.getResources(pattern(location));
        } catch (IOException e) {
            throw new UncheckedIOException("could not scan " + location, e);
        }

        Map<Integer, Resource> upgrades = new TreeMap<>();
        Map<Integer, Resource> undos = new TreeMap<>();
        Map<Integer, String> descriptions = new TreeMap<>();
        for (Resource resource : resources) {
            String name = resource.getFilename();
            Matcher matcher = name == null ? null : SCRIPT_NAME.matcher(name);
            if (matcher == null || !matcher.matches()) {
                log.debug("Ignoring {} in {}", name, location);
                continue;
            }
            boolean upgrade = "V".equals(matcher.group(1));
            int number;
            try {
                number = Integer.parseInt(matcher.group(2));
            } catch (NumberFormatException e) {
                throw new IllegalStateException(
                        "version number of " + name + " is out of range", e);
            }
            Map<Integer, Resource> target = upgrade ? upgrades : undos;
            Resource previous = target.putIfAbsent(number, resource);
            if (previous != null) {
                throw new IllegalStateException(
                        "duplicate "
                                + (upgrade ? "upgrade" : "undo")
                                + " scripts for version "
                                + number
                                + ": "
                                + previous.getFilename()
                                + " and "
                                + name);
            }
            if (upgrade) {
                descriptions.put(number, matcher.group(3).replace('_', ' '));
            }
        }

        for (Integer number : undos.keySet()) {
            if (!upgrades.containsKey(number)) {
                throw new IllegalStateException(
                        "undo script "
                                + undos.get(number).getFilename()
                                + " has no upgrade script");
            }
        }

        List<Version> versions = new ArrayList<>();
        for (Map.Entry<Integer, Resource> entry : upgrades.entrySet()) {
            int number = entry.getKey();
            versions.add(
                    new SqlScriptVersion(
                            number,
                            descriptions.get(number),
                            entry.getValue(),
                            undos.get(number),
                            connections));
        }
        log.debug("Found {} version script(s) in {}", versions.size(), location);
        return versions;
    }

    private static String pattern(String location) {
        return location.endsWith("/") ? location + "*.sql" : location + "/*.sql";
    }
}
