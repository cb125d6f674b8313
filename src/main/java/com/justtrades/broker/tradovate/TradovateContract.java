package com.justtrades.broker.tradovate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TradovateContract(long id, String name) {}
