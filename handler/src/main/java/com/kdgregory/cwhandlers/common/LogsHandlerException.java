// Copyright (c) Keith D Gregory
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
// limitations under the License.

package com.kdgregory.cwhandlers.common;


/**
 *  Base class for all exceptions thrown by the handler. Exceptions from the
 *  underlying transport (network or authorization failures) are not wrapped,
 *  so callers that want to handle everything should also catch
 *  <code>RuntimeException</code>.
 */
public class LogsHandlerException
extends RuntimeException
{
    private static final long serialVersionUID = 1L;


    public LogsHandlerException(String message)
    {
        super(message);
    }


    public LogsHandlerException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
