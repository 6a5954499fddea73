package me.golemcore.testinsight.domain.model;

/**
 * Every secret field of {@link SettingsDocument}, addressed by section and
 * snake_case field name.
 */
public enum SecretField {

    JENKINS_API_TOKEN("jenkins", "api_token") {
        @Override
        public Secret get(SettingsDocument document) {
            return document.getJenkins().getApiToken();
        }

        @Override
        public void set(SettingsDocument document, Secret secret) {
            document.getJenkins().setApiToken(secret);
        }
    },

    GITHUB_TOKEN("github", "token") {
        @Override
        public Secret get(SettingsDocument document) {
            return document.getGithub().getToken();
        }

        @Override
        public void set(SettingsDocument document, Secret secret) {
            document.getGithub().setToken(secret);
        }
    },

    AI_API_KEY("ai", "api_key") {
        @Override
        public Secret get(SettingsDocument document) {
            return document.getAi().getApiKey();
        }

        @Override
        public void set(SettingsDocument document, Secret secret) {
            document.getAi().setApiKey(secret);
        }
    };

    private final String section;
    private final String field;

    SecretField(String section, String field) {
        this.section = section;
        this.field = field;
    }

    public String getSection() {
        return section;
    }

    public String getField() {
        return field;
    }

    public String path() {
        return section + "." + field;
    }

    public abstract Secret get(SettingsDocument document);

    public abstract void set(SettingsDocument document, Secret secret);
}
