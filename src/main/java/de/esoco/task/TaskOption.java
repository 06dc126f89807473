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

import java.util.Objects;


/********************************************************************
 * A typed configuration option that can be set on a {@link TaskContext}. An
 * option may have a default value that is returned by contexts on which the
 * option has not been set. The standard options are defined in {@link Tasks}.
 *
 * @author eso
 */
public final class TaskOption<T>
{
	//~ Instance fields --------------------------------------------------------

	private final String sName;
	private final T		 rDefault;

	//~ Constructors -----------------------------------------------------------

	/***************************************
	 * Creates a new instance.
	 *
	 * @param sName    The option name
	 * @param rDefault The default value or NULL for none
	 */
	private TaskOption(String sName, T rDefault)
	{
		Objects.requireNonNull(sName);

		this.sName    = sName;
		this.rDefault = rDefault;
	}

	//~ Static methods ---------------------------------------------------------

	/***************************************
	 * Creates a new option with a default value.
	 *
	 * @param  sName    The option name
	 * @param  rDefault The default value
	 *
	 * @return The new option
	 */
	public static <T> TaskOption<T> newDefaultOption(String sName, T rDefault)
	{
		Objects.requireNonNull(rDefault);

		return new TaskOption<>(sName, rDefault);
	}

	/***************************************
	 * Creates a new option without a default value.
	 *
	 * @param  sName The option name
	 *
	 * @return The new option
	 */
	public static <T> TaskOption<T> newOption(String sName)
	{
		return new TaskOption<>(sName, null);
	}

	//~ Methods ----------------------------------------------------------------

	/***************************************
	 * Returns the default value of this option.
	 *
	 * @return The default value or NULL for none
	 */
	public T getDefault()
	{
		return rDefault;
	}

	/***************************************
	 * Returns the name of this option.
	 *
	 * @return The option name
	 */
	public String getName()
	{
		return sName;
	}

	/***************************************
	 * {@inheritDoc}
	 */
	@Override
	public String toString()
	{
		return sName;
	}
}
