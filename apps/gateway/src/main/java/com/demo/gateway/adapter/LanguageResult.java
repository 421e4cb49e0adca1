package com.demo.gateway.adapter;

public record LanguageResult(String text, String model) {
}
