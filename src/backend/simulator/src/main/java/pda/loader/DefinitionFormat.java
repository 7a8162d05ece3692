package pda.loader;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Supported definition file formats, detected from the file suffix.
 */
public enum DefinitionFormat {
    YAML, JSON, TEXT, CSV;

    public static DefinitionFormat of(Path path) throws LoadException {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String suffix = dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
        switch (suffix) {
            case "yaml":
            case "yml":
                return YAML;
            case "json":
                return JSON;
            case "txt":
            case "pda":
            case "ascii":
                return TEXT;
            case "csv":
                return CSV;
            default:
                throw new LoadException("Unrecognized definition format '" + (suffix.isEmpty() ? name : "." + suffix)
                        + "' for " + path + "; use .yaml/.yml, .json, .txt/.pda/.ascii or .csv");
        }
    }
}
