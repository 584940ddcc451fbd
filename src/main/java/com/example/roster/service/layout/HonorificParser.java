package com.example.roster.service.layout;

import com.example.roster.dto.layout.HonorificSplit;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a name line such as {@code "H.E. Mr. John Smith"} into its title and the person's name.
 */
@Component
public class HonorificParser {

    private final HonorificLexicon lexicon;

    @Autowired
    public HonorificParser(@Value("${roster.honorifics.resource:honorifics.txt}") String lexiconResource) {
        this(HonorificLexicon.fromClasspath(lexiconResource));
    }

    public HonorificParser(HonorificLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public HonorificSplit split(String line) {
        String text = line == null ? "" : line.trim();
        for (Pattern fragment : lexicon.fragments()) {
            Matcher matcher = fragment.matcher(text);
            if (matcher.lookingAt()) {
                String honorific = matcher.group().trim();
                String person = text.substring(matcher.end()).trim();
                return new HonorificSplit(honorific, person);
            }
        }
        return new HonorificSplit("", text);
    }
}
