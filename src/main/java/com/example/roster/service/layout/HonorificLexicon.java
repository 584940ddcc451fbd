package com.example.roster.service.layout;

import com.example.roster.service.RosterExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered list of title fragments. Each entry is a small regular expression
 * matched against the start of a name line; the first entry that matches wins,
 * so compound titles have to be listed before their bare prefixes.
 */
public class HonorificLexicon {

    private static final Logger logger = LoggerFactory.getLogger(HonorificLexicon.class);

    private final List<Pattern> fragments;

    private HonorificLexicon(List<Pattern> fragments) {
        this.fragments = Collections.unmodifiableList(fragments);
    }

    /**
     * Builds a lexicon from raw lines. Blank lines and lines starting with '#' are ignored;
     * no other trimming happens, since a trailing escaped space is part of a fragment.
     */
    public static HonorificLexicon fromLines(List<String> lines) {
        List<Pattern> patterns = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            try {
                patterns.add(Pattern.compile(line));
            } catch (PatternSyntaxException e) {
                throw new RosterExtractionException("Invalid honorific fragment: " + line, e);
            }
        }
        return new HonorificLexicon(patterns);
    }

    public static HonorificLexicon fromClasspath(String resource) {
        ClassPathResource classPathResource = new ClassPathResource(resource);
        if (!classPathResource.exists()) {
            throw new RosterExtractionException("Honorific lexicon not found on classpath: " + resource);
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(classPathResource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new RosterExtractionException("Could not read honorific lexicon " + resource, e);
        }
        HonorificLexicon lexicon = fromLines(lines);
        logger.debug("Loaded {} honorific fragments from {}", lexicon.size(), resource);
        return lexicon;
    }

    public List<Pattern> fragments() {
        return fragments;
    }

    public int size() {
        return fragments.size();
    }
}
