package com.demo.gateway.adapter;

/**
 * @param type synonym, antonym, related, rhyme or creative
 */
public record WordSuggestion(String word, String type, double score, String definition) {
}
