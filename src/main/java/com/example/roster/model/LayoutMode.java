package com.example.roster.model;

public enum LayoutMode {
    SINGLE,
    TWO
}
