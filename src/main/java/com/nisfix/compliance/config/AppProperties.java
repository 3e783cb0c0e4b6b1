package com.nisfix.compliance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix="app")
public class AppProperties {
    private MagicLink magicLink = new MagicLink();
    private Invitation invitation = new Invitation();
    private Sweep sweep = new Sweep();

    public MagicLink getMagicLink(){ return magicLink; }
    public Invitation getInvitation(){ return invitation; }
    public Sweep getSweep(){ return sweep; }

    public static class MagicLink {
        /** Frontend origin; links point at {baseUrl}/auth/verify/{identifier}. */
        private String baseUrl = "http://localhost:3000";
        private int validityMinutes = 15;
        private int rateLimitMax = 3;
        private int rateLimitWindowMinutes = 60;

        public String getBaseUrl(){ return baseUrl; }
        public void setBaseUrl(String baseUrl){ this.baseUrl = baseUrl; }
        public int getValidityMinutes(){ return validityMinutes; }
        public void setValidityMinutes(int validityMinutes){ this.validityMinutes = validityMinutes; }
        public int getRateLimitMax(){ return rateLimitMax; }
        public void setRateLimitMax(int rateLimitMax){ this.rateLimitMax = rateLimitMax; }
        public int getRateLimitWindowMinutes(){ return rateLimitWindowMinutes; }
        public void setRateLimitWindowMinutes(int rateLimitWindowMinutes){ this.rateLimitWindowMinutes = rateLimitWindowMinutes; }
    }

    public static class Invitation {
        /** Links point at {baseUrl}/auth/invitation/{identifier}. */
        private String baseUrl = "http://localhost:3000";
        private int validityDays = 7;

        public String getBaseUrl(){ return baseUrl; }
        public void setBaseUrl(String baseUrl){ this.baseUrl = baseUrl; }
        public int getValidityDays(){ return validityDays; }
        public void setValidityDays(int validityDays){ this.validityDays = validityDays; }
    }

    public static class Sweep {
        private boolean expiryEnabled = true;
        private boolean reminderEnabled = true;
        private boolean retentionEnabled = true;
        private int reminderDaysBefore = 7;
        private int batchSize = 100;
        private int outboxRetentionDays = 30;

        public boolean isExpiryEnabled(){ return expiryEnabled; }
        public void setExpiryEnabled(boolean expiryEnabled){ this.expiryEnabled = expiryEnabled; }
        public boolean isReminderEnabled(){ return reminderEnabled; }
        public void setReminderEnabled(boolean reminderEnabled){ this.reminderEnabled = reminderEnabled; }
        public boolean isRetentionEnabled(){ return retentionEnabled; }
        public void setRetentionEnabled(boolean retentionEnabled){ this.retentionEnabled = retentionEnabled; }
        public int getReminderDaysBefore(){ return reminderDaysBefore; }
        public void setReminderDaysBefore(int reminderDaysBefore){ this.reminderDaysBefore = reminderDaysBefore; }
        public int getBatchSize(){ return batchSize; }
        public void setBatchSize(int batchSize){ this.batchSize = batchSize; }
        public int getOutboxRetentionDays(){ return outboxRetentionDays; }
        public void setOutboxRetentionDays(int outboxRetentionDays){ this.outboxRetentionDays = outboxRetentionDays; }
    }
}
