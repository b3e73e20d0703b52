package io.intellixity.querygate.plan;

public enum Clause { AND, OR }
