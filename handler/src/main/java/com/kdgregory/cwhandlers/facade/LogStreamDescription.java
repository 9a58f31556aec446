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

package com.kdgregory.cwhandlers.facade;


/**
 *  The parts of a log stream's description that the handler cares about.
 */
public class LogStreamDescription
{
    private final String name;
    private final String uploadSequenceToken;


    public LogStreamDescription(String name, String uploadSequenceToken)
    {
        this.name = name;
        this.uploadSequenceToken = uploadSequenceToken;
    }


    public String getName()
    {
        return name;
    }


    /**
     *  Returns the token for the next write, <code>null</code> if the stream
     *  has never been written.
     */
    public String getUploadSequenceToken()
    {
        return uploadSequenceToken;
    }
}
