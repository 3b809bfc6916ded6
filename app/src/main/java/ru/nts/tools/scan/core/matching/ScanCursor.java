/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.scan.core.matching;

/**
 * Позиция сканирования между чанками: индекс текущего состояния автомата
 * и число уже поглощённых байтов потока.
 *
 * Это единственное состояние, которое переживает границу чанка. Значение неизменяемо:
 * {@link MatchAutomaton#advance} возвращает новый курсор, поэтому сканирование можно
 * возобновить с любого сохранённого курсора.
 *
 * @param state    Индекс состояния автомата (0 - корень).
 * @param position Количество байтов, поглощённых с начала потока.
 */
public record ScanCursor(int state, long position) {

    /**
     * Курсор в начале потока.
     */
    public static final ScanCursor START = new ScanCursor(MatchAutomaton.ROOT, 0);

    public ScanCursor {
        if (state < 0) {
            throw new IllegalArgumentException("state must be non-negative: " + state);
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
    }
}
