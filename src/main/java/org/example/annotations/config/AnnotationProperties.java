package org.example.annotations.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "annotations")
public class AnnotationProperties {

    private Export export = new Export();
    private Settings settings = new Settings();

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export == null ? new Export() : export;
    }

    public Settings getSettings() {
        return settings;
    }

    public void setSettings(Settings settings) {
        this.settings = settings == null ? new Settings() : settings;
    }

    public static class Export {
        private String appName = "Read Master";
        private String locale = "en-US";
        private String zone = "UTC";

        public String getAppName() {
            return appName;
        }

        public void setAppName(String appName) {
            this.appName = appName;
        }

        public String getLocale() {
            return locale;
        }

        public void setLocale(String locale) {
            this.locale = locale;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Settings {
        private String storageDir = "./data/settings";
        private String key = "notes-panel-settings";

        public String getStorageDir() {
            return storageDir;
        }

        public void setStorageDir(String storageDir) {
            this.storageDir = storageDir;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }
}
