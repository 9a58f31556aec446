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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 *  Thrown when the handler is constructed with an invalid configuration.
 *  The message combines all problems; they're also available individually.
 */
public class ConfigurationException
extends LogsHandlerException
{
    private static final long serialVersionUID = 1L;

    private final List<String> problems;


    public ConfigurationException(List<String> problems)
    {
        super("invalid configuration: " + String.join("; ", problems));
        this.problems = Collections.unmodifiableList(new ArrayList<>(problems));
    }


    public List<String> getProblems()
    {
        return problems;
    }
}
