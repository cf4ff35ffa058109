package com.company.triage.service;

import com.company.triage.domain.Alert;
import com.company.triage.domain.AlertGroup;
import com.company.triage.domain.GroupKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
@Slf4j
public class AlertGroupingService {

    /**
     * Partition alerts by (service, component) in one pass.
     * Groups come back in order of first appearance of their key.
     */
    public List<AlertGroup> group(List<Alert> alerts) {
        List<AlertGroup> groups = new ArrayList<>();
        Map<GroupKey, Integer> indexByKey = new HashMap<>();

        for (Alert alert : alerts) {
            GroupKey key = alert.groupKey();
            Integer index = indexByKey.get(key);

            if (index == null) {
                index = groups.size();
                groups.add(AlertGroup.forKey(key));
                indexByKey.put(key, index);
            }

            groups.get(index).addAlert(alert);
        }

        log.debug("Grouped {} alerts into {} groups", alerts.size(), groups.size());

        return Collections.unmodifiableList(groups);
    }
}
