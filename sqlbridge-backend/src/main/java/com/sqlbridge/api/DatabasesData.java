package com.sqlbridge.api;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class DatabasesData {
    private List<String> databases;
    private int total;
}
