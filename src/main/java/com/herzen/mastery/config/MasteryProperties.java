package com.herzen.mastery.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "mastery")
@Validated
public class MasteryProperties {

    @Min(1)
    private int historyLimit = 100;

    @Valid
    private Review review = new Review();

    @Valid
    private Weak weak = new Weak();

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public Review getReview() {
        return review;
    }

    public void setReview(Review review) {
        this.review = review;
    }

    public Weak getWeak() {
        return weak;
    }

    public void setWeak(Weak weak) {
        this.weak = weak;
    }

    public static class Review {
        @Min(1)
        private int maxItems = 10;

        public int getMaxItems() {
            return maxItems;
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = maxItems;
        }
    }

    public static class Weak {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double masteryThreshold = 0.4;

        @Min(0)
        private int inactivityDays = 7;

        public double getMasteryThreshold() {
            return masteryThreshold;
        }

        public void setMasteryThreshold(double masteryThreshold) {
            this.masteryThreshold = masteryThreshold;
        }

        public int getInactivityDays() {
            return inactivityDays;
        }

        public void setInactivityDays(int inactivityDays) {
            this.inactivityDays = inactivityDays;
        }
    }
}
