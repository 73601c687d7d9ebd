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

import java.util.HashMap;
import java.util.Map;

/**
 * Exception for command line parameter errors (missing, invalid, unknown command or target).
 */
public class RmsParamException extends RmsException {

    public RmsParamException(RmsErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    /**
     * Factory: Missing required parameter
     */
    public static RmsParamException missing(String paramName) {
        return new RmsParamException(RmsErrorCode.PARAM_MISSING,
                Map.of("parameter", paramName));
    }

    /**
     * Factory: Invalid parameter value
     */
    public static RmsParamException invalid(String paramName, Object value, String expected) {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("parameter", paramName);
        ctx.put("value", value);
        ctx.put("expected", expected);
        return new RmsParamException(RmsErrorCode.PARAM_INVALID, ctx);
    }

    /**
     * Factory: Unknown compatibility target name
     */
    public static RmsParamException unknownCompatibility(String value, String expected) {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("value", value);
        ctx.put("expected", expected);
        return new RmsParamException(RmsErrorCode.UNKNOWN_COMPATIBILITY, ctx);
    }
}
