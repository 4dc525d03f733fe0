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
package ru.nts.tools.atomic.core.transaction;

import ru.nts.tools.atomic.core.NtsErrorCode;
import ru.nts.tools.atomic.core.NtsException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Бросается {@link AtomicEditManager#inTransaction}, если commit завершился неуспешно.
 * Полный результат (с разделением ошибок валидации, применения и отката) доступен через
 * {@link #getResult()}.
 */
public class TransactionFailedException extends NtsException {

    private final TransactionResult result;

    public TransactionFailedException(TransactionResult result) {
        super(NtsErrorCode.TRANSACTION_FAILED, createContext(result));
        this.result = result;
    }

    private static Map<String, Object> createContext(TransactionResult result) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("transaction", result.getTransactionId());
        ctx.put("state", result.getState().name());
        ctx.put("errors", result.getErrors());
        return ctx;
    }

    public TransactionResult getResult() {
        return result;
    }
}
