package io.intellixity.querygate.plan;

public enum AggregateFunction { COUNT, SUM, AVG, MIN, MAX }
