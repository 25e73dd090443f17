/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */
package com.amazon.rpsestimator.features;

import static com.amazon.rpsestimator.CommonUtils.checkArgument;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * The engineered feature relation: named columns and the rows that have a full
 * look-back history.
 */
@Getter
public class FeatureFrame {

    private final List<String> columns;

    private final List<FeatureRow> rows;

    private final Map<String, Integer> columnIndex;

    public FeatureFrame(List<String> columns, List<FeatureRow> rows) {
        checkNotNull(columns, "columns cannot be null");
        checkNotNull(rows, "rows cannot be null");
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            checkArgument(index.put(columns.get(i), i) == null, "duplicate column " + columns.get(i));
        }
        for (FeatureRow row : rows) {
            checkArgument(row.getValues().length == columns.size(), "row width does not match the columns");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.columnIndex = Collections.unmodifiableMap(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columnIndex.containsKey(name);
    }

    public double getValue(int row, String column) {
        Integer index = columnIndex.get(column);
        checkArgument(index != null, "unknown column " + column);
        return rows.get(row).getValue(index);
    }

    /**
     * @param order column names in the order the matrix should hold them
     * @return one array per row, each holding the named columns in the given order
     */
    public double[][] toMatrix(List<String> order) {
        int[] positions = new int[order.size()];
        for (int j = 0; j < positions.length; j++) {
            Integer index = columnIndex.get(order.get(j));
            checkArgument(index != null, "unknown column " + order.get(j));
            positions[j] = index;
        }
        double[][] matrix = new double[rows.size()][positions.length];
        for (int i = 0; i < rows.size(); i++) {
            FeatureRow row = rows.get(i);
            for (int j = 0; j < positions.length; j++) {
                matrix[i][j] = row.getValue(positions[j]);
            }
        }
        return matrix;
    }
}
