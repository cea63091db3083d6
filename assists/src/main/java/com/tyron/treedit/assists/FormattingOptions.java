package com.tyron.treedit.assists;

import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Formatting conventions used when new syntax is spliced into existing code.
 * <p>
 * Loaded from a YAML file:
 * <pre>
 * indentSize: 4
 * useTabs: false
 * </pre>
 * The file is taken from the path in the {@value #CONFIG_PATH_KEY} system property, else from the classpath
 * resource {@value #DEFAULT_RESOURCE}. The {@value #INDENT_KEY} system property ({@code tab} or a number of
 * spaces) overrides the indentation of whatever was loaded.
 */
public final class FormattingOptions {

    public static final String CONFIG_PATH_KEY = "treedit.formatting.config";
    public static final String INDENT_KEY = "treedit.formatting.indent";
    public static final String DEFAULT_RESOURCE = "treedit-formatting.yaml";

    private static final Logger LOG = Logger.getLogger(FormattingOptions.class.getName());

    private static final FormattingOptions DEFAULTS = new FormattingOptions(4, false);

    private static volatile FormattingOptions instance;

    private final int indentSize;
    private final boolean useTabs;

    private FormattingOptions(int indentSize, boolean useTabs) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
        this.useTabs = useTabs;
    }

    public static FormattingOptions of(int indentSize, boolean useTabs) {
        return new FormattingOptions(indentSize, useTabs);
    }

    public static FormattingOptions defaults() {
        return DEFAULTS;
    }

    /**
     * @return the process-wide options, loaded on first use
     */
    public static FormattingOptions getInstance() {
        FormattingOptions result = instance;
        if (result == null) {
            synchronized (FormattingOptions.class) {
                result = instance;
                if (result == null) {
                    result = load();
                    instance = result;
                }
            }
        }
        return result;
    }

    /**
     * Loads the options from the configured file or resource. A missing or unreadable configuration falls back
     * to {@link #defaults()}.
     */
    public static FormattingOptions load() {
        FormattingOptions loaded = loadConfigured();
        return applyIndentOverride(loaded, System.getProperty(INDENT_KEY));
    }

    private static FormattingOptions loadConfigured() {
        String path = System.getProperty(CONFIG_PATH_KEY);
        if (path != null && !path.isBlank()) {
            try (InputStream in = Files.newInputStream(Path.of(path))) {
                return fromYaml(in);
            } catch (IOException | RuntimeException e) {
                LOG.log(Level.WARNING, "formattingOptions action=load result=fail source=" + path, e);
                return DEFAULTS;
            }
        }

        InputStream resource = FormattingOptions.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (resource == null) {
            return DEFAULTS;
        }
        try (InputStream in = resource) {
            return fromYaml(in);
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "formattingOptions action=load result=fail source=classpath:" + DEFAULT_RESOURCE, e);
            return DEFAULTS;
        }
    }

    /**
     * @throws IllegalArgumentException if the document is not a mapping or holds values of the wrong type
     */
    public static FormattingOptions fromYaml(@NotNull InputStream in) {
        Objects.requireNonNull(in, "in");
        Object doc = new Yaml().load(in);
        if (doc == null) {
            return DEFAULTS;
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("formatting configuration must be a mapping, got " + doc.getClass().getSimpleName());
        }

        int indentSize = DEFAULTS.indentSize;
        Object size = map.get("indentSize");
        if (size != null) {
            if (!(size instanceof Integer i)) {
                throw new IllegalArgumentException("indentSize must be an integer, got '" + size + "'");
            }
            indentSize = i;
        }

        boolean useTabs = DEFAULTS.useTabs;
        Object tabs = map.get("useTabs");
        if (tabs != null) {
            if (!(tabs instanceof Boolean b)) {
                throw new IllegalArgumentException("useTabs must be a boolean, got '" + tabs + "'");
            }
            useTabs = b;
        }

        FormattingOptions options = new FormattingOptions(indentSize, useTabs);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("formattingOptions action=load " + options);
        }
        return options;
    }

    static FormattingOptions applyIndentOverride(FormattingOptions options, String raw) {
        if (raw == null || raw.isBlank()) {
            return options;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("tab") || value.equals("tabs")) {
            return new FormattingOptions(options.indentSize, true);
        }
        try {
            return new FormattingOptions(Integer.parseInt(value), false);
        } catch (IllegalArgumentException e) {
            LOG.warning("formattingOptions action=override result=ignored key=" + INDENT_KEY + " value=" + raw);
            return options;
        }
    }

    public int getIndentSize() {
        return indentSize;
    }

    public boolean isUseTabs() {
        return useTabs;
    }

    /**
     * @return the text of one indentation level
     */
    @NotNull
    public String getIndentUnit() {
        return useTabs ? "\t" : " ".repeat(indentSize);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormattingOptions other)) return false;
        return indentSize == other.indentSize && useTabs == other.useTabs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(indentSize, useTabs);
    }

    @Override
    public String toString() {
        return "indentSize=" + indentSize + " useTabs=" + useTabs;
    }
}
