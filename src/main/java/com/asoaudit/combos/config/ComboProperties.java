package com.asoaudit.combos.config;

import com.asoaudit.combos.service.combo.EngineConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine defaults. Requests may override stopwords, noise threshold and rule set.
 *
 * Properties are prefixed with "combo" in application.yml.
 */
@ConfigurationProperties(prefix = "combo")
public class ComboProperties {
    /** Ceiling on C(n,2)+C(n,3)+C(n,4) candidates per analysis */
    private int maxCombos = EngineConfig.DEFAULT_MAX_COMBOS;
    /** Noise confidence at or above which a combo is flagged as noise */
    private double noiseThreshold = 0.6;
    /** Max entries in recommendedToAdd */
    private int recommendationLimit = 10;
    /** Stopword list; empty means the built-in defaults */
    private List<String> stopwords = new ArrayList<>();
    /** Filler terms for noise scoring; empty means the built-in defaults */
    private List<String> lowValueTerms = new ArrayList<>();
    /** Competitor aliases applied when a request sends none */
    private List<String> defaultCompetitorAliases = new ArrayList<>();
    /** Origin patterns allowed to call the API from a browser */
    private List<String> corsAllowedOrigins = new ArrayList<>(List.of("*"));

    public int getMaxCombos() { return maxCombos; }
    public void setMaxCombos(int maxCombos) { this.maxCombos = maxCombos; }

    public double getNoiseThreshold() { return noiseThreshold; }
    public void setNoiseThreshold(double noiseThreshold) { this.noiseThreshold = noiseThreshold; }

    public int getRecommendationLimit() { return recommendationLimit; }
    public void setRecommendationLimit(int recommendationLimit) { this.recommendationLimit = recommendationLimit; }

    public List<String> getStopwords() { return stopwords; }
    public void setStopwords(List<String> stopwords) { this.stopwords = stopwords; }

    public List<String> getLowValueTerms() { return lowValueTerms; }
    public void setLowValueTerms(List<String> lowValueTerms) { this.lowValueTerms = lowValueTerms; }

    public List<String> getDefaultCompetitorAliases() { return defaultCompetitorAliases; }
    public void setDefaultCompetitorAliases(List<String> defaultCompetitorAliases) { this.defaultCompetitorAliases = defaultCompetitorAliases; }

    public List<String> getCorsAllowedOrigins() { return corsAllowedOrigins; }
    public void setCorsAllowedOrigins(List<String> corsAllowedOrigins) { this.corsAllowedOrigins = corsAllowedOrigins; }
}
