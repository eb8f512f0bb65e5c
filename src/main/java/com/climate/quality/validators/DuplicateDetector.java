package com.climate.quality.validators;

import com.climate.quality.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 重复记录检测器。
 * 所有列取值完全相同（缺失与缺失视为相同）的记录中，首次出现的不标记，其后出现的均标记。
 */
public class DuplicateDetector {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    public SortedSet<Integer> detect(Dataset data) {
        SortedSet<Integer> duplicates = new TreeSet<>();
        Set<List<Object>> seen = new HashSet<>();

        for (int i = 0; i < data.getRowCount(); i++) {
            if (!seen.add(data.getRow(i))) {
                duplicates.add(i);
            }
        }

        if (!duplicates.isEmpty()) {
            log.debug("Found {} duplicate row(s)", duplicates.size());
        }
        return duplicates;
    }
}
