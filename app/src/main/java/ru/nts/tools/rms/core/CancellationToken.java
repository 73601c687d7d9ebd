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
package ru.nts.tools.rms.core;

import java.util.concurrent.CancellationException;

/**
 * Кооперативный сигнал отмены проверки.
 * Проверяется парсером между токенами верхнего уровня и движком правил между вызовами правил.
 * Отменённая проверка не возвращает частичный результат: вызывающая сторона получает
 * {@link CancellationException}.
 */
public class CancellationToken {

    /**
     * Токен, который никогда не отменяется.
     */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
    };

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException(RmsErrorCode.CHECK_CANCELLED.getMessage());
        }
    }
}
