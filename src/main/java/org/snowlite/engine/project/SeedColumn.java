package org.snowlite.engine.project;

public record SeedColumn(String name, String type) {
}
