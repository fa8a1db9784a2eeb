package com.catalog.inventory.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ImportReport {
    private int added;
    private int skipped;
    private List<DuplicateEntry> duplicates = new ArrayList<>();

    public void countAdded() {
        added++;
    }

    public void countSkipped() {
        skipped++;
    }

    public void addDuplicate(String name, Long existingId) {
        duplicates.add(new DuplicateEntry(name, existingId));
        skipped++;
    }
}
