package com.astroinsight.astroinsight_backend.coder;

import com.astroinsight.astroinsight_backend.classifier.ClassifierPort;
import com.astroinsight.astroinsight_backend.exception.ClassifierException;
import com.astroinsight.astroinsight_backend.model.code.DatasetInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetSelector {

    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+");

    private final ClassifierPort classifier;

    /**
     * Empty when there is nothing to choose from. A single dataset is taken without asking
     * the classifier; otherwise an invalid or failed reply falls back to the first dataset.
     */
    public Optional<DatasetInfo> select(List<DatasetInfo> datasets, String request) {
        if (datasets.isEmpty()) return Optional.empty();
        if (datasets.size() == 1) return Optional.of(datasets.get(0));

        try {
            String reply = classifier.classify(CodePrompts.datasetSelection(DatasetCatalog.summary(datasets), request));
            int index = parseIndex(reply, datasets.size());
            if (index >= 0) return Optional.of(datasets.get(index));
            log.warn("Dataset selection reply '{}' is not a valid index, using the first dataset", reply);
        } catch (ClassifierException e) {
            log.warn("Dataset selection failed, using the first dataset: {}", e.getMessage());
        }
        return Optional.of(datasets.get(0));
    }

    /** 1-based index in the reply, converted to 0-based; -1 when absent or out of range. */
    static int parseIndex(String reply, int size) {
        if (reply == null) return -1;
        Matcher m = FIRST_NUMBER.matcher(reply);
        if (!m.find()) return -1;
        try {
            int n = Integer.parseInt(m.group());
            return n >= 1 && n <= size ? n - 1 : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
