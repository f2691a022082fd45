package com.newsrelay.core.model;

public enum SourceType {
    RSS,
    HTML
}
