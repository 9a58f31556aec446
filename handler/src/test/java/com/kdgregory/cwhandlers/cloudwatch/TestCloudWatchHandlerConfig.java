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

package com.kdgregory.cwhandlers.cloudwatch;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;
import static org.junit.Assert.*;

import net.sf.kdgcommons.lang.StringUtil;


public class TestCloudWatchHandlerConfig
{
    @Test
    public void testDefaults() throws Exception
    {
        CloudWatchHandlerConfig config = new CloudWatchHandlerConfig();

        assertNull("log group name",                            config.getLogGroupName());
        assertNull("log stream name",                           config.getLogStreamName());
        assertNull("capacity",                                  config.getCapacity());
        assertEquals("effective capacity",          10,         config.getEffectiveCapacity());
        assertNull("retention period",                          config.getRetentionPeriod());
        assertEquals("truncation suffix",           " ...",     config.getTruncationSuffix());
        assertEquals("rejection policy",  RejectionPolicy.RETAIN, config.getRejectionPolicy());
        assertNull("client factory",                            config.getClientFactoryMethod());
        assertNull("client region",                             config.getClientRegion());
        assertNull("client endpoint",                           config.getClientEndpoint());
    }


    @Test
    public void testNormalization() throws Exception
    {
        CloudWatchHandlerConfig config = new CloudWatchHandlerConfig()
                                         .setLogStreamName("")
                                         .setTruncationSuffix(null)
                                         .setRejectionPolicy(null)
                                         .setCapacity(0);

        assertNull("empty stream name",                         config.getLogStreamName());
        assertEquals("null suffix",                 "",         config.getTruncationSuffix());
        assertEquals("null policy",       RejectionPolicy.RETAIN, config.getRejectionPolicy());
        assertEquals("zero capacity",               10,         config.getEffectiveCapacity());
    }


    @Test
    public void testValidConfiguration() throws Exception
    {
        CloudWatchHandlerConfig config = new CloudWatchHandlerConfig()
                                         .setLogGroupName("/aws/example_group.1#2-3")
                                         .setLogStreamName("2024-03-15 instance i-1234")
                                         .setCapacity(10000)
                                         .setRetentionPeriod(3653);

        assertEquals("validation problems", Collections.emptyList(), config.validate());
        assertEquals("effective capacity",  10000,                   config.getEffectiveCapacity());
    }


    @Test
    public void testMissingGroupName() throws Exception
    {
        assertEquals(Arrays.asList("missing log group name"),
                     new CloudWatchHandlerConfig().validate());
    }


    @Test
    public void testInvalidNames() throws Exception
    {
        CloudWatchHandlerConfig config = new CloudWatchHandlerConfig()
                                         .setLogGroupName("has:colon")
                                         .setLogStreamName("has*star");

        assertEquals(Arrays.asList("invalid log group name: has:colon",
                                   "invalid log stream name: has*star"),
                     config.validate());

        String tooLong = StringUtil.repeat('x', 513);
        config.setLogGroupName(tooLong).setLogStreamName(tooLong);
        assertEquals("problem count for oversize names", 2, config.validate().size());
    }


    @Test
    public void testCapacityRange() throws Exception
    {
        CloudWatchHandlerConfig config = new CloudWatchHandlerConfig().setLogGroupName("example");

        config.setCapacity(-1);
        assertEquals(Arrays.asList("capacity not in range 0 ... 10000: -1"), config.validate());

        config.setCapacity(10001);
        assertEquals(Arrays.asList("capacity not in range 0 ... 10000: 10001"), config.validate());

        config.setCapacity(1);
        assertEquals(Collections.emptyList(), config.validate());
    }


    @Test
    public void testRetentionPeriod() throws Exception
    {
        CloudWatchHandlerConfig config = new CloudWatchHandlerConfig().setLogGroupName("example");

        for (int days : new int[] { 1, 3, 5, 7, 14, 30, 60, 90, 120, 150, 180, 365, 400, 545, 731, 1096, 1827, 2192, 2557, 2922, 3288, 3653 })
        {
            config.setRetentionPeriod(days);
            assertEquals("valid retention: " + days, Collections.emptyList(), config.validate());
        }

        config.setRetentionPeriod(2);
        assertEquals(Arrays.asList("invalid retention period: 2; see AWS API for allowed values"), config.validate());
    }


    @Test
    public void testRejectionPolicyLookup() throws Exception
    {
        assertEquals("exact",           RejectionPolicy.RETAIN,     RejectionPolicy.lookup("RETAIN"));
        assertEquals("mixed case",      RejectionPolicy.DISCARD,    RejectionPolicy.lookup(" Discard "));
        assertNull("unknown",                                       RejectionPolicy.lookup("drop"));
        assertNull("null",                                          RejectionPolicy.lookup(null));
    }
}
