package com.demo.gateway.adapter;

public record ImageResult(String url, String prompt, String model) {
}
