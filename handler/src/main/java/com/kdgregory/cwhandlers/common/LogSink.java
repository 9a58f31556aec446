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

import java.io.Closeable;


/**
 *  The contract between a logging framework and a destination: records are
 *  emitted one at a time, may be explicitly flushed, and the sink is closed
 *  when the framework shuts down.
 *  <p>
 *  All operations are synchronous, and all failures are reported by throwing
 *  an unchecked exception to the caller. Implementations are not required to
 *  be threadsafe; callers that share a sink between threads must serialize
 *  access to it.
 */
public interface LogSink<R>
extends Closeable
{
    /**
     *  Accepts a single record. This may cause previously accepted records to
     *  be written to the destination before the new record is retained.
     */
    void emit(R record);


    /**
     *  Writes all retained records to the destination.
     */
    void flush();


    /**
     *  Makes a final attempt to write any retained records, then releases all
     *  resources held by the sink. Resources are released even if that write
     *  fails.
     */
    @Override
    void close();
}
