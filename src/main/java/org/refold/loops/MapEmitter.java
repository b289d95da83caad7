/*
 * Copyright 2025 The Refold Authors
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

package org.refold.loops;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.refold.target.TargetExpr;
import org.refold.target.TargetExpr.Fn;
import org.refold.target.TargetExpr.RemoteCall;

/**
 * Emits {@code Enum.map(source, fn x -> value end)} for a loop that yields one value per element,
 * binding the result to the loop's collect target.
 */
final class MapEmitter extends LoopEmitter {

  MapEmitter(EmitSupport support) {
    super(support);
  }

  @Override
  ImmutableList<TargetExpr> emit(LoopIr ir) {
    Preconditions.checkArgument(
        ir.yieldShape != null && ir.clauses.size() == 1, "Not a map: %s", ir);
    LoopIr.Clause generator = ir.clauses.get(0);
    TargetExpr source = support.source(generator.source);
    TargetExpr pattern = support.pattern(generator.binder, yieldUses(ir));
    TargetExpr body = support.withReserved(ImmutableList.of(pattern), () -> yieldBody(ir));
    TargetExpr mapped =
        RemoteCall.of("Enum", "map", source, new Fn(ImmutableList.of(pattern), body));
    return collect(ir, support.var(ir.yieldShape.target), mapped);
  }
}
