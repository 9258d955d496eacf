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

/**
 * Parameters for the {@code nesfab/statusUpdate} notification.
 */
public class StatusUpdateParams {

    public static final String INDEXING = "indexing";
    public static final String READY = "ready";
    public static final String ERROR = "error";

    /** One of {@link #INDEXING}, {@link #READY} or {@link #ERROR}. */
    private String state;

    private String message;

    public StatusUpdateParams() {
    }

    public StatusUpdateParams(String state, String message) {
        this.state = state;
        this.message = message;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    @Override
    public String toString() {
        return "StatusUpdateParams[state=" + state + ", message=" + message + "]";
    }
}
