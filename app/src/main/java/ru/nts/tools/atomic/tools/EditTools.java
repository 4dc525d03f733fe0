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
package ru.nts.tools.atomic.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import ru.nts.tools.atomic.core.McpRouter;
import ru.nts.tools.atomic.core.SessionContext;
import ru.nts.tools.atomic.tools.editing.EditFileTool;
import ru.nts.tools.atomic.tools.editing.MultiFileEditTool;
import ru.nts.tools.atomic.tools.editing.WriteFileTool;
import ru.nts.tools.atomic.tools.session.FileHistoryTool;
import ru.nts.tools.atomic.tools.session.RedoTool;
import ru.nts.tools.atomic.tools.session.UndoTool;

/**
 * Регистрация инструментов правки для одной сессии.
 */
public final class EditTools {

    private EditTools() {
    }

    public static McpRouter createRouter(SessionContext session, ObjectMapper mapper) {
        McpRouter router = new McpRouter(mapper);
        registerAll(router, session);
        return router;
    }

    public static void registerAll(McpRouter router, SessionContext session) {
        // Editing
        router.registerTool(new WriteFileTool(session));
        router.registerTool(new EditFileTool(session));
        router.registerTool(new MultiFileEditTool(session));

        // Session history
        router.registerTool(new UndoTool(session));
        router.registerTool(new RedoTool(session));
        router.registerTool(new FileHistoryTool(session));
    }
}
