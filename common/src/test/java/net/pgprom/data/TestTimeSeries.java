// This file is part of pgprom.
// Copyright (C) 2026  The pgprom Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pgprom.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.pgprom.core.Const;

public class TestTimeSeries {

  @Test
  public void appendAndMerge() throws Exception {
    final TimeSeries series = new TimeSeries(Lists.newArrayList(
        new LabelPair(Const.METRIC_NAME_LABEL, "up"),
        new LabelPair("job", "node")));
    assertTrue(series.dataPoints().isEmpty());
    series.addDataPoint(2000, 1).addDataPoint(1000, 0);
    
    final TimeSeries other = new TimeSeries(series.labels(), 
        Lists.newArrayList(new DataPoint(3000, 1)));
    series.addAll(other);
    
    assertEquals(Lists.newArrayList(
        new DataPoint(2000, 1), 
        new DataPoint(1000, 0), 
        new DataPoint(3000, 1)), series.dataPoints());
    assertEquals(1, other.dataPoints().size());
    assertEquals("up", series.labelValue(Const.METRIC_NAME_LABEL));
    assertEquals("node", series.labelValue("job"));
    assertNull(series.labelValue("host"));
  }
  
  @Test(expected = UnsupportedOperationException.class)
  public void labelsImmutable() throws Exception {
    new TimeSeries(Lists.<LabelPair>newArrayList()).labels()
      .add(new LabelPair("a", "b"));
  }
  
  @Test(expected = NullPointerException.class)
  public void nullLabels() throws Exception {
    new TimeSeries(null);
  }
}
