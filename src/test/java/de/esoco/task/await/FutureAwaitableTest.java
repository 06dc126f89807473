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
package de.esoco.task.await;

import de.esoco.task.TaskException;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;


/********************************************************************
 * Test of {@link FutureAwaitable} and {@link Awaitables}.
 *
 * @author eso
 */
public class FutureAwaitableTest
{
	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Test of context-insensitive awaiting.
	 */
	@Test
	public void testConfigureAwait()
	{
		AtomicInteger			  aDispatches = new AtomicInteger();
		Executor				  rExecutor   =
			r ->
			{
				aDispatches.incrementAndGet();
				r.run();
			};
		CompletableFuture<String> fFuture	  = new CompletableFuture<>();
		FutureAwaitable<String>   aAwaitable  =
			Awaitables.of(fFuture, rExecutor);

		assertSame(aAwaitable, aAwaitable.configureAwait(true));

		FutureAwaitable<String> rDirect =
			(FutureAwaitable<String>) aAwaitable.configureAwait(false);

		assertNotSame(aAwaitable, rDirect);
		assertNull(rDirect.getResumeExecutor());
		assertSame(fFuture, rDirect.getFuture());

		AtomicInteger aCallbacks = new AtomicInteger();

		rDirect.getAwaiter().onCompleted(aCallbacks::incrementAndGet);
		fFuture.complete("DONE");

		assertEquals(1, aCallbacks.get());
		assertEquals(0, aDispatches.get());
	}

	/***************************************
	 * Test of retrieving failures.
	 */
	@Test
	public void testGetFailure()
	{
		CompletableFuture<String> fFailed    = new CompletableFuture<>();
		CompletableFuture<String> fCancelled = new CompletableFuture<>();
		CompletableFuture<String> fError     = new CompletableFuture<>();

		fFailed.completeExceptionally(new IOException("TEST"));
		fCancelled.cancel(false);
		fError.completeExceptionally(new AssertionError("TEST"));

		IOException eIO =
			assertThrows(
				IOException.class,
				() -> Awaitables.of(fFailed).getAwaiter().getResult());

		assertEquals("TEST", eIO.getMessage());
		assertThrows(
			CancellationException.class,
			() -> Awaitables.of(fCancelled).getAwaiter().getResult());
		assertThrows(
			AssertionError.class,
			() -> Awaitables.of(fError).getAwaiter().getResult());
	}

	/***************************************
	 * Test of retrieving a result.
	 *
	 * @throws Exception On errors
	 */
	@Test
	public void testGetResult() throws Exception
	{
		CompletableFuture<String> fFuture  = new CompletableFuture<>();
		Awaiter<String>			  rAwaiter = Awaitables.of(fFuture).getAwaiter();

		assertFalse(rAwaiter.isCompleted());
		assertThrows(TaskException.class, rAwaiter::getResult);

		fFuture.complete("RESULT");

		assertTrue(rAwaiter.isCompleted());
		assertEquals("RESULT", rAwaiter.getResult());
	}

	/***************************************
	 * Test that callbacks are dispatched to the resume executor.
	 */
	@Test
	public void testResumeExecutor()
	{
		AtomicInteger			   aDispatches = new AtomicInteger();
		AtomicInteger			   aCallbacks  = new AtomicInteger();
		CompletableFuture<Integer> fFuture     = new CompletableFuture<>();

		Awaitables.of(
					  fFuture,
					  r ->
					  {
						  aDispatches.incrementAndGet();
						  r.run();
					  })
				  .getAwaiter()
				  .onCompleted(aCallbacks::incrementAndGet);

		assertEquals(0, aCallbacks.get());

		fFuture.complete(1);

		assertEquals(1, aDispatches.get());
		assertEquals(1, aCallbacks.get());
	}

	/***************************************
	 * Test of {@link Awaitables#unwrap(Throwable)} and {@link
	 * Awaitables#rethrow(Throwable)}.
	 */
	@Test
	public void testUnwrap()
	{
		IOException eCause = new IOException("CAUSE");

		assertSame(
			eCause,
			Awaitables.unwrap(
				new CompletionException(new ExecutionException(eCause))));
		assertSame(eCause, Awaitables.unwrap(eCause));
		assertSame(eCause, Awaitables.rethrow(new CompletionException(eCause)));
		assertThrows(
			AssertionError.class,
			() -> Awaitables.rethrow(new AssertionError("ERROR")));
		assertTrue(
			Awaitables.rethrow(new Throwable("OTHER")) instanceof TaskException);
	}
}
