/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.flexsql.ast;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visits and transforms syntax trees.
 *
 * <p>The base implementation rebuilds each node from the transformed versions
 * of its children, and returns the original node if no child changed. It
 * never modifies a node.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  /** Visits a child node. Every child of every node is visited via this
   * method, so a sub-class can override it to track how deep it is. */
  @SuppressWarnings("unchecked")
  protected <E extends SqlNode> E go(E node) {
    return (E) node.accept(this);
  }

  protected <E extends SqlNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      list.add(go(node));
    }
    return list;
  }

  protected <E extends SqlNode> @Nullable E visitOptional(@Nullable E node) {
    return node == null ? null : go(node);
  }

  // operators

  protected Sql.Exp visit(Sql.UnaryCall unaryCall) {
    return unaryCall.copy(go(unaryCall.a));
  }

  protected Sql.Exp visit(Sql.BinaryCall binaryCall) {
    return binaryCall.copy(go(binaryCall.a0), go(binaryCall.a1));
  }

  protected Sql.Exp visit(Sql.TernaryCall ternaryCall) {
    return ternaryCall.copy(
        go(ternaryCall.a0),
        go(ternaryCall.a1),
        go(ternaryCall.a2));
  }

  // leaves

  protected Sql.Exp visit(Sql.Literal literal) {
    return literal; // leaf
  }

  protected Sql.Exp visit(Sql.Verbatim verbatim) {
    return verbatim; // leaf
  }

  protected Sql.TypeName visit(Sql.TypeName typeName) {
    return typeName; // leaf
  }

  protected Sql.Exp visit(Sql.Placeholder placeholder) {
    return placeholder; // leaf
  }

  protected Sql.Exp visit(Sql.Column column) {
    return column; // leaf
  }

  protected Sql.Table visit(Sql.Table table) {
    return table; // leaf
  }

  protected Sql.LabeledTable visit(Sql.LabeledTable labeledTable) {
    return labeledTable; // leaf
  }

  // expressions

  protected Sql.Exp visit(Sql.Cast cast) {
    return cast.copy(go(cast.exp), go(cast.type));
  }

  protected Sql.Exp visit(Sql.FunctionCall functionCall) {
    return functionCall.copy(visitList(functionCall.args));
  }

  protected Sql.Exp visit(Sql.Tuple tuple) {
    return tuple.copy(visitList(tuple.args));
  }

  protected Sql.Exp visit(Sql.Case caseOf) {
    return caseOf.copy(
        visitList(caseOf.conditions),
        visitList(caseOf.results),
        visitOptional(caseOf.otherwise));
  }

  protected Sql.Exp visit(Sql.ScalarSubquery scalarSubquery) {
    return scalarSubquery.copy(go(scalarSubquery.select));
  }

  // clauses

  protected Sql.LabeledColumn visit(Sql.LabeledColumn labeledColumn) {
    return labeledColumn.copy(go(labeledColumn.exp));
  }

  protected Sql.Subquery visit(Sql.Subquery subquery) {
    return subquery.copy(go(subquery.select));
  }

  protected Sql.Join visit(Sql.Join join) {
    return join.copy(
        go(join.left), go(join.right), go(join.on));
  }

  protected Sql.FromItem visit(Sql.FromItem fromItem) {
    return fromItem.copy(
        visitOptional(fromItem.table),
        visitOptional(fromItem.subquery),
        visitOptional(fromItem.join));
  }

  protected Sql.From visit(Sql.From from) {
    return from.copy(go(from.item));
  }

  protected Sql.Where visit(Sql.Where where) {
    return where.copy(go(where.exp));
  }

  protected Sql.GroupBy visit(Sql.GroupBy groupBy) {
    return groupBy.copy(visitList(groupBy.exps));
  }

  protected Sql.Having visit(Sql.Having having) {
    return having.copy(go(having.exp));
  }

  protected Sql.OrderItem visit(Sql.OrderItem orderItem) {
    return orderItem.copy(go(orderItem.exp));
  }

  protected Sql.OrderBy visit(Sql.OrderBy orderBy) {
    return orderBy.copy(visitList(orderBy.items));
  }

  protected Sql.Limit visit(Sql.Limit limit) {
    return limit.copy(go(limit.exp));
  }

  protected Sql.Offset visit(Sql.Offset offset) {
    return offset.copy(go(offset.exp));
  }

  protected Sql.Select visit(Sql.Select select) {
    return select.copy(
        visitList(select.columns),
        visitOptional(select.from),
        visitOptional(select.where),
        visitOptional(select.groupBy),
        visitOptional(select.having),
        visitOptional(select.orderBy),
        visitOptional(select.limit),
        visitOptional(select.offset));
  }
}

// End Shuttle.java
