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
package net.hydromatic.exgraph.graph;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/**
 * Vocabulary of the core ontology: expressions, literals, operators,
 * patterns and control flow.
 *
 * <p>Class constants are capitalized and property constants are not, as in
 * Jena's own vocabularies.
 */
@SuppressWarnings("checkstyle:ConstantName")
public class Core {
  /** Namespace of the core ontology. */
  public static final String NS = "https://w3id.org/elixir-code/core#";

  private Core() {}

  private static Node uri(String localName) {
    return NodeFactory.createURI(NS + localName);
  }

  // expressions, references and calls

  public static final Node Expression = uri("Expression");
  public static final Node Variable = uri("Variable");
  public static final Node ModuleReference = uri("ModuleReference");
  public static final Node ModuleAttributeReference =
      uri("ModuleAttributeReference");
  public static final Node Block = uri("Block");
  public static final Node RemoteCall = uri("RemoteCall");
  public static final Node LocalCall = uri("LocalCall");

  // literals

  public static final Node AtomLiteral = uri("AtomLiteral");
  public static final Node BooleanLiteral = uri("BooleanLiteral");
  public static final Node NilLiteral = uri("NilLiteral");
  public static final Node IntegerLiteral = uri("IntegerLiteral");
  public static final Node FloatLiteral = uri("FloatLiteral");
  public static final Node StringLiteral = uri("StringLiteral");
  public static final Node CharlistLiteral = uri("CharlistLiteral");
  public static final Node BinaryLiteral = uri("BinaryLiteral");
  public static final Node ListLiteral = uri("ListLiteral");
  public static final Node TupleLiteral = uri("TupleLiteral");
  public static final Node MapLiteral = uri("MapLiteral");
  public static final Node MapEntry = uri("MapEntry");
  public static final Node StructLiteral = uri("StructLiteral");
  public static final Node KeywordListLiteral = uri("KeywordListLiteral");
  public static final Node SigilLiteral = uri("SigilLiteral");
  public static final Node RangeLiteral = uri("RangeLiteral");

  // operators

  public static final Node ComparisonOperator = uri("ComparisonOperator");
  public static final Node LogicalOperator = uri("LogicalOperator");
  public static final Node ArithmeticOperator = uri("ArithmeticOperator");
  public static final Node PipeOperator = uri("PipeOperator");
  public static final Node MatchOperator = uri("MatchOperator");
  public static final Node StringConcatOperator = uri("StringConcatOperator");
  public static final Node ListOperator = uri("ListOperator");
  public static final Node InOperator = uri("InOperator");
  public static final Node CaptureOperator = uri("CaptureOperator");
  public static final Node PartialApplication = uri("PartialApplication");

  // patterns

  public static final Node LiteralPattern = uri("LiteralPattern");
  public static final Node VariablePattern = uri("VariablePattern");
  public static final Node WildcardPattern = uri("WildcardPattern");
  public static final Node PinPattern = uri("PinPattern");
  public static final Node TuplePattern = uri("TuplePattern");
  public static final Node ListPattern = uri("ListPattern");
  public static final Node MapPattern = uri("MapPattern");
  public static final Node StructPattern = uri("StructPattern");
  public static final Node BinaryPattern = uri("BinaryPattern");
  public static final Node AsPattern = uri("AsPattern");
  public static final Node GuardClause = uri("GuardClause");

  // control flow

  public static final Node IfExpression = uri("IfExpression");
  public static final Node UnlessExpression = uri("UnlessExpression");
  public static final Node CondExpression = uri("CondExpression");
  public static final Node CondClause = uri("CondClause");
  public static final Node CaseExpression = uri("CaseExpression");
  public static final Node MatchClause = uri("MatchClause");
  public static final Node WithExpression = uri("WithExpression");
  public static final Node WithClause = uri("WithClause");
  public static final Node ForComprehension = uri("ForComprehension");
  public static final Node Generator = uri("Generator");
  public static final Node Filter = uri("Filter");
  public static final Node TryExpression = uri("TryExpression");
  public static final Node RescueClause = uri("RescueClause");
  public static final Node CatchClause = uri("CatchClause");
  public static final Node AfterClause = uri("AfterClause");
  public static final Node RaiseExpression = uri("RaiseExpression");
  public static final Node ThrowExpression = uri("ThrowExpression");
  public static final Node ExitExpression = uri("ExitExpression");
  public static final Node ReceiveExpression = uri("ReceiveExpression");
  public static final Node Closure = uri("Closure");

  // literal values

  public static final Node atomValue = uri("atomValue");
  public static final Node integerValue = uri("integerValue");
  public static final Node floatValue = uri("floatValue");
  public static final Node stringValue = uri("stringValue");
  public static final Node charlistValue = uri("charlistValue");
  public static final Node binaryValue = uri("binaryValue");
  public static final Node sigilChar = uri("sigilChar");
  public static final Node sigilContent = uri("sigilContent");
  public static final Node sigilModifiers = uri("sigilModifiers");
  public static final Node name = uri("name");
  public static final Node sourceForm = uri("sourceForm");

  // structure of literals

  public static final Node hasElement = uri("hasElement");
  public static final Node hasTail = uri("hasTail");
  public static final Node hasEntry = uri("hasEntry");
  public static final Node entryKey = uri("entryKey");
  public static final Node hasEntryValue = uri("hasEntryValue");
  public static final Node rangeStart = uri("rangeStart");
  public static final Node rangeEnd = uri("rangeEnd");
  public static final Node rangeStep = uri("rangeStep");

  // operators, calls and references

  public static final Node operatorSymbol = uri("operatorSymbol");
  public static final Node hasLeftOperand = uri("hasLeftOperand");
  public static final Node hasRightOperand = uri("hasRightOperand");
  public static final Node hasOperand = uri("hasOperand");
  public static final Node hasArgument = uri("hasArgument");
  public static final Node hasExpression = uri("hasExpression");
  public static final Node refersToModule = uri("refersToModule");
  public static final Node refersToFunction = uri("refersToFunction");
  public static final Node hasReceiver = uri("hasReceiver");

  // captures and closures

  public static final Node captureIndex = uri("captureIndex");
  public static final Node captureModuleName = uri("captureModuleName");
  public static final Node captureFunctionName = uri("captureFunctionName");
  public static final Node captureArity = uri("captureArity");
  public static final Node captureGap = uri("captureGap");
  public static final Node placeholderUsageCount =
      uri("placeholderUsageCount");
  public static final Node capturesVariable = uri("capturesVariable");
  public static final Node referenceCount = uri("referenceCount");
  public static final Node captureDepth = uri("captureDepth");
  public static final Node crossesFunctionBoundary =
      uri("crossesFunctionBoundary");

  // patterns and clauses

  public static final Node bindsVariable = uri("bindsVariable");
  public static final Node hasPattern = uri("hasPattern");
  public static final Node hasGuard = uri("hasGuard");
  public static final Node hasBody = uri("hasBody");
  public static final Node hasClause = uri("hasClause");
  public static final Node clauseOrder = uri("clauseOrder");

  // control flow

  public static final Node hasSubject = uri("hasSubject");
  public static final Node hasCondition = uri("hasCondition");
  public static final Node hasThenBranch = uri("hasThenBranch");
  public static final Node hasElseBranch = uri("hasElseBranch");
  public static final Node hasElseClause = uri("hasElseClause");
  public static final Node hasGenerator = uri("hasGenerator");
  public static final Node hasFilter = uri("hasFilter");
  public static final Node generatorSource = uri("generatorSource");
  public static final Node hasIntoOption = uri("hasIntoOption");
  public static final Node hasReduceOption = uri("hasReduceOption");
  public static final Node hasUniqOption = uri("hasUniqOption");
  public static final Node intoTarget = uri("intoTarget");
  public static final Node reduceInitial = uri("reduceInitial");
  public static final Node hasRescueClause = uri("hasRescueClause");
  public static final Node hasCatchClause = uri("hasCatchClause");
  public static final Node hasAfterClause = uri("hasAfterClause");
  public static final Node rescuesException = uri("rescuesException");
  public static final Node catchKind = uri("catchKind");
  public static final Node hasExceptionType = uri("hasExceptionType");
  public static final Node hasMessage = uri("hasMessage");
  public static final Node hasAttributes = uri("hasAttributes");
  public static final Node hasStacktrace = uri("hasStacktrace");
  public static final Node isReraise = uri("isReraise");
  public static final Node hasThrownValue = uri("hasThrownValue");
  public static final Node hasExitReason = uri("hasExitReason");
  public static final Node hasAfterTimeout = uri("hasAfterTimeout");
  public static final Node hasTimeout = uri("hasTimeout");
  public static final Node isNonBlocking = uri("isNonBlocking");

  // source locations

  public static final Node startLine = uri("startLine");
  public static final Node startColumn = uri("startColumn");
  public static final Node endLine = uri("endLine");
}

// End Core.java
