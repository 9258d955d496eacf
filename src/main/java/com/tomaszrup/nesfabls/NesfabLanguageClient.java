////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.nesfabls;

import org.eclipse.lsp4j.jsonrpc.services.JsonNotification;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Language client with the NESFab-specific {@code nesfab/statusUpdate}
 * notification used to drive the client's status bar.
 */
public interface NesfabLanguageClient extends LanguageClient {

    /**
     * Notify the client of a server status change.
     *
     * @param params the status update parameters containing {@code state}
     *               ({@code "indexing"}, {@code "ready"}, {@code "error"})
     *               and an optional {@code message} detail
     */
    @JsonNotification("nesfab/statusUpdate")
    void statusUpdate(StatusUpdateParams params);
}
