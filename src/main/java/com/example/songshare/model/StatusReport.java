package com.example.songshare.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StatusReport {

    String backend;
    String database;
    String databaseName;
    boolean databaseUrlConfigured;
    List<String> collections;
}
