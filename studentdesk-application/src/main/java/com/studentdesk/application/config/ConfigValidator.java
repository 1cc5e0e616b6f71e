package com.studentdesk.application.config;

import com.studentdesk.application.ports.ConfigPort;

public final class ConfigValidator {

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        String url = config.get(ConfigKey.DB_URL.key(), "");
        if (!url.isBlank()) {
            if (!url.trim().startsWith("jdbc:")) {
                res.addError("db.url must start with jdbc:");
            }
            return res;
        }

        for (ConfigKey k : ConfigKey.values()) {
            if (k.isOptional()) continue;

            String v = k.isSecret() ? config.getSecret(k.key()) : config.get(k.key());
            if (v == null || v.isBlank()) {
                res.addError("Missing required " + (k.isSecret() ? "secret" : "config") + ": " + k.key());
            }
        }

        String port = config.get(ConfigKey.DB_PORT.key(), "");
        if (!port.isBlank()) {
            try {
                int p = Integer.parseInt(port.trim());
                if (p < 1 || p > 65535) res.addError("db.port must be between 1 and 65535: " + port);
            } catch (NumberFormatException e) {
                res.addError("db.port must be a number: " + port);
            }
        }

        return res;
    }
}
