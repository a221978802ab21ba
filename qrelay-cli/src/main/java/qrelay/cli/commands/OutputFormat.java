package qrelay.cli.commands;

public enum OutputFormat {
    TABLE,
    JSON
}
