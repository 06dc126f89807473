//++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++
// This file is a part of the 'task-builder' project.
// Copyright 2018 Elmar Sonnenschein, esoco GmbH, Flensburg, Germany
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//	  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++++
package de.esoco.task;

import de.esoco.task.await.Awaitable;
import de.esoco.task.await.ConfigurableAwaitable;
import de.esoco.task.step.Bind;
import de.esoco.task.step.Combine;
import de.esoco.task.step.ControlFlow;
import de.esoco.task.step.ForLoop;
import de.esoco.task.step.TryFinally;
import de.esoco.task.step.TryWith;
import de.esoco.task.step.Using;
import de.esoco.task.step.WhileLoop;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;


/********************************************************************
 * The builder API for the mapping of sequential code to tasks. Each method
 * corresponds to a construct of sequential code (return, sequencing, loops,
 * try-catch, try-finally, try-with-resources, and awaiting a result) so that
 * a front-end can translate such code mechanically into invocations of this
 * builder. A simple example:
 *
 * <pre>
 * CompletableFuture&lt;Integer&gt; fResult =
 *     Tasks.task(b -&gt; b.bind(fInput, i -&gt; b.ret(i + 1)));
 * </pre>
 *
 * <p>A builder contains the {@link LabelTable} of a single task and must
 * therefore only be used for the steps of one task which is executed by
 * invoking {@link #run(StepCode)}. The method {@link
 * Tasks#task(TaskContext, StepFunction)} creates a new builder for each task.
 * </p>
 *
 * @author eso
 */
public class TaskBuilder
{
	//~ Instance fields --------------------------------------------------------

	private final TaskContext rContext;
	private final LabelTable  aLabels = new LabelTable();

	private boolean bStarted = false;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance for the default context.
	 */
	public TaskBuilder()
	{
		this(Tasks.getDefaultContext());
	}

	/***************************************
	 * Creates a new instance for a certain context.
	 *
	 * @param rContext The task context
	 */
	public TaskBuilder(TaskContext rContext)
	{
		Objects.requireNonNull(rContext);

		this.rContext = rContext;
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Awaits a future and continues with it's result. The task resumes with
	 * the resume executor of the builder's context.
	 *
	 * @param  fFuture       The future to await
	 * @param  fContinuation The continuation that receives the result
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the continuation is invoked directly and fails
	 */
	public <T1, T2> TaskStep<T2> bind(
		CompletableFuture<T1>		 fFuture,
		StepFunction<? super T1, T2> fContinuation) throws Exception
	{
		return Bind.bind(aLabels, rContext.awaitable(fFuture), fContinuation);
	}

	/***************************************
	 * Awaits an arbitrary awaitable and continues with it's result.
	 *
	 * @param  rAwaitable    The awaitable
	 * @param  fContinuation The continuation that receives the result
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the continuation is invoked directly and fails
	 */
	public <T1, T2> TaskStep<T2> bind(
		Awaitable<T1>				 rAwaitable,
		StepFunction<? super T1, T2> fContinuation) throws Exception
	{
		return Bind.bind(aLabels, rAwaitable, fContinuation);
	}

	/***************************************
	 * Awaits a future and continues with it's result without resuming in the
	 * builder's context.
	 *
	 * @param  fFuture       The future to await
	 * @param  fContinuation The continuation that receives the result
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the continuation is invoked directly and fails
	 */
	public <T1, T2> TaskStep<T2> bindConfigureFalse(
		CompletableFuture<T1>		 fFuture,
		StepFunction<? super T1, T2> fContinuation) throws Exception
	{
		return Bind.bindConfigureFalse(
			aLabels,
			rContext.awaitable(fFuture),
			fContinuation);
	}

	/***************************************
	 * Awaits a configurable awaitable and continues with it's result without
	 * resuming in the originating context.
	 *
	 * @param  rAwaitable    The awaitable
	 * @param  fContinuation The continuation that receives the result
	 *
	 * @return The resulting step
	 *
	 * @throws Exception If the continuation is invoked directly and fails
	 */
	public <T1, T2> TaskStep<T2> bindConfigureFalse(
		ConfigurableAwaitable<T1>	 rAwaitable,
		StepFunction<? super T1, T2> fContinuation) throws Exception
	{
		return Bind.bindConfigureFalse(aLabels, rAwaitable, fContinuation);
	}

	/***************************************
	 * Sequences a step without result with the code that follows it.
	 *
	 * @see Combine#combine(LabelTable, TaskStep, StepCode)
	 */
	public <T> TaskStep<T> combine(TaskStep<Void> rFirstStep, StepCode<T> fRest)
		throws Exception
	{
		return Combine.combine(aLabels, rFirstStep, fRest);
	}

	/***************************************
	 * Returns the context of this builder.
	 *
	 * @return The task context
	 */
	public final TaskContext context()
	{
		return rContext;
	}

	/***************************************
	 * Delays the execution of code. This returns the argument code unchanged,
	 * it exists to support the mechanical translation of blocks.
	 *
	 * @param  fCode The code to delay
	 *
	 * @return The same code
	 */
	public <T> StepCode<T> delay(StepCode<T> fCode)
	{
		return fCode;
	}

	/***************************************
	 * Executes a body for each element of an iterable.
	 *
	 * @see ForLoop#forLoop(LabelTable, Iterable, StepFunction)
	 */
	public <E> TaskStep<Void> forLoop(
		Iterable<E>					  rSequence,
		StepFunction<? super E, Void> fBody) throws Exception
	{
		return ForLoop.forLoop(aLabels, rSequence, fBody);
	}

	/***************************************
	 * Executes a body for each element of a stream.
	 *
	 * @see ForLoop#forLoop(LabelTable, Stream, StepFunction)
	 */
	public <E> TaskStep<Void> forLoop(
		Stream<E>					  rStream,
		StepFunction<? super E, Void> fBody) throws Exception
	{
		return ForLoop.forLoop(aLabels, rStream, fBody);
	}

	/***************************************
	 * Returns the label table of this builder.
	 *
	 * @return The label table
	 */
	public final LabelTable labels()
	{
		return aLabels;
	}

	/***************************************
	 * Returns a value as the task result.
	 *
	 * @see ControlFlow#ret(Object)
	 */
	public <T> TaskStep<T> ret(T rValue)
	{
		return ControlFlow.ret(rValue);
	}

	/***************************************
	 * Hands off the task result to another future.
	 *
	 * @see ControlFlow#returnFrom(CompletableFuture)
	 */
	public <T> TaskStep<T> returnFrom(CompletableFuture<T> fTask)
	{
		return ControlFlow.returnFrom(fTask);
	}

	/***************************************
	 * Returns the result of an arbitrary awaitable as the task result.
	 *
	 * @see Bind#returnFromAwaitable(LabelTable, Awaitable)
	 */
	public <T> TaskStep<T> returnFromAwaitable(Awaitable<T> rAwaitable)
		throws Exception
	{
		return Bind.returnFromAwaitable(aLabels, rAwaitable);
	}

	/***************************************
	 * Runs the task and returns a future of it's result. This method never
	 * throws an exception. A builder can only be run once because the labels
	 * of it's task belong to a single execution. Further invocations return a
	 * future that has failed with an {@link IllegalStateException}.
	 *
	 * @see Tasks#run(TaskContext, LabelTable, StepCode)
	 */
	public <T> CompletableFuture<T> run(StepCode<T> fCode)
	{
		if (bStarted)
		{
			return Tasks.run(
				rContext,
				aLabels,
				() ->
				{
					throw new IllegalStateException("Task has already been run");
				});
		}

		bStarted = true;

		return Tasks.run(rContext, aLabels, fCode);
	}

	/***************************************
	 * Executes code with a compensation.
	 *
	 * @see TryFinally#tryFinally(LabelTable, StepCode, Compensation)
	 */
	public <T> TaskStep<T> tryFinally(
		StepCode<T>  fCode,
		Compensation fCompensation) throws Exception
	{
		return TryFinally.tryFinally(aLabels, fCode, fCompensation);
	}

	/***************************************
	 * Executes code with an exception handler.
	 *
	 * @see TryWith#tryWith(LabelTable, StepCode, StepFunction)
	 */
	public <T> TaskStep<T> tryWith(
		StepCode<T>						   fCode,
		StepFunction<? super Exception, T> fCatch) throws Exception
	{
		return TryWith.tryWith(aLabels, fCode, fCatch);
	}

	/***************************************
	 * Executes a body with a resource that is closed afterwards.
	 *
	 * @see Using#using(LabelTable, AutoCloseable, StepFunction)
	 */
	public <R extends AutoCloseable, T> TaskStep<T> using(
		R							rResource,
		StepFunction<? super R, T> fBody) throws Exception
	{
		return Using.using(aLabels, rResource, fBody);
	}

	/***************************************
	 * Executes a loop body while a condition is TRUE.
	 *
	 * @see WhileLoop#whileLoop(LabelTable, LoopCondition, StepCode)
	 */
	public TaskStep<Void> whileLoop(
		LoopCondition  fCondition,
		StepCode<Void> fBody) throws Exception
	{
		return WhileLoop.whileLoop(aLabels, fCondition, fBody);
	}

	/***************************************
	 * Returns a step without result.
	 *
	 * @see ControlFlow#zero()
	 */
	public TaskStep<Void> zero()
	{
		return ControlFlow.zero();
	}
}
