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

package com.kdgregory.cwhandlers.log4j2.internal;

import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.Layout;


/**
 *  Defines the configuration properties of <code>CloudWatchAppender</code>.
 *  Log4J2 populates the appender's builder, which then serves as the
 *  appender's configuration.
 */
public interface CloudWatchAppenderConfig
{
    Layout<String> getLayout();

    Filter getFilter();

    String getLogGroup();

    String getLogStream();

    Integer getCapacity();

    Integer getRetentionPeriod();

    String getTruncationSuffix();

    boolean isDiscardRejectedEvents();

    String getClientFactory();

    String getClientRegion();

    String getClientEndpoint();
}
