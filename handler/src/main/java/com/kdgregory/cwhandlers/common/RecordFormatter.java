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
 *  Converts a framework-specific logging record into the pieces that the
 *  handler needs. Appenders provide an implementation that delegates to
 *  their configured layout.
 */
public interface RecordFormatter<R>
{
    /**
     *  Renders the record as text.
     */
    String format(R record);


    /**
     *  Returns the creation time of the record, as milliseconds since the epoch.
     */
    long timestamp(R record);
}
