package com.example.diffreview.domain;

public enum DiffLineKind {
    CONTEXT,
    ADD,
    REMOVE
}
