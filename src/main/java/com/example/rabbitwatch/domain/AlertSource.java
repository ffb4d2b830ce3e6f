package com.example.rabbitwatch.domain;

/**
 * What an alert is about: a node, a queue, or the cluster as a whole.
 */
public record AlertSource(SourceType type, String name) {

    public static AlertSource node(String name) {
        return new AlertSource(SourceType.NODE, name);
    }

    public static AlertSource queue(String name) {
        return new AlertSource(SourceType.QUEUE, name);
    }

    public static AlertSource cluster(String name) {
        return new AlertSource(SourceType.CLUSTER, name);
    }
}
