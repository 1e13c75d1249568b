package com.example.roster.config;

import com.example.roster.domain.parser.LineClassifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the roster parser, bound from {@code roster.parser.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "roster.parser")
public class RosterParserProperties {

    /** Upper-case boilerplate phrases; an all-caps line containing one of them is never a header. */
    private List<String> noisePhrases = new ArrayList<>(LineClassifier.DEFAULT_NOISE_PHRASES);

    /** Fewer committees than this marks the run as degraded. */
    private int minimumCommittees = 8;

    /** When set, a run without any subcommittee is marked as degraded. */
    private boolean requireSubcommittees = true;

    public List<String> getNoisePhrases() {
        return noisePhrases;
    }

    public void setNoisePhrases(List<String> noisePhrases) {
        this.noisePhrases = noisePhrases;
    }

    public int getMinimumCommittees() {
        return minimumCommittees;
    }

    public void setMinimumCommittees(int minimumCommittees) {
        this.minimumCommittees = minimumCommittees;
    }

    public boolean isRequireSubcommittees() {
        return requireSubcommittees;
    }

    public void setRequireSubcommittees(boolean requireSubcommittees) {
        this.requireSubcommittees = requireSubcommittees;
    }
}
