package com.example.acfeed;

public enum Currency {
    RON,
    USD,
    EUR
}
