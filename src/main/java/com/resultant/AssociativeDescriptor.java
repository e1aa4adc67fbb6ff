/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.resultant;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A parsed associative descriptor, which controls the shape of the tree built by {@link Result#fetchAssocTree(String)}.
 * <p>
 * A descriptor is a comma-separated list of tokens. Each token is one of:
 * <ul>
 *   <li>a column name (case-sensitive, not trimmed) - groups rows into a map keyed by that column's value</li>
 *   <li>{@value #WILDCARD_TOKEN} - an indexed level: every row gets its own entry in a list</li>
 *   <li>{@value #RECORD_TOKEN} - stores the whole row at this level and keeps branching inside it, under the
 *   entry named by the following token</li>
 * </ul>
 * For example, {@code "category,*"} builds {@code {category value -> [row, row, ...]}} and
 * {@code "customer,#,order"} builds {@code {customer value -> row with its "order" entry replaced by {order value -> row}}}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class AssociativeDescriptor {
	@NonNull
	public static final String WILDCARD_TOKEN = "*";
	@NonNull
	public static final String RECORD_TOKEN = "#";
	@NonNull
	public static final String TOKEN_SEPARATOR = ",";

	@NonNull
	private final String descriptor;
	@NonNull
	private final List<String> tokens;

	private AssociativeDescriptor(@NonNull String descriptor) {
		this.descriptor = requireNonNull(descriptor);
		// Limit of -1 keeps trailing empty tokens, which then fail validation like any other unknown column
		this.tokens = List.copyOf(Arrays.asList(descriptor.split(TOKEN_SEPARATOR, -1)));
	}

	/**
	 * Parses the given descriptor string.
	 *
	 * @param descriptor comma-separated descriptor tokens
	 * @return the parsed descriptor
	 */
	@NonNull
	public static AssociativeDescriptor parse(@NonNull String descriptor) {
		requireNonNull(descriptor);
		return new AssociativeDescriptor(descriptor);
	}

	/**
	 * Verifies that every column token names one of the given columns.
	 *
	 * @param columnNames the columns available in the rows to be shaped
	 * @throws IllegalArgumentException if a column token is not in {@code columnNames}
	 */
	public void validate(@NonNull Set<String> columnNames) {
		requireNonNull(columnNames);

		for (String token : getTokens())
			if (!isReservedToken(token) && !columnNames.contains(token))
				throw new IllegalArgumentException(format("Unknown column '%s' in associative descriptor '%s'", token, getDescriptor()));
	}

	/**
	 * A descriptor with a single column token maps each key directly to its row.
	 *
	 * @return the single column name, or empty if this descriptor has more than one token or a reserved token
	 */
	@NonNull
	public Optional<String> getSingleColumn() {
		if (getTokens().size() != 1 || isReservedToken(getTokens().get(0)))
			return Optional.empty();

		return Optional.of(getTokens().get(0));
	}

	/**
	 * The tokens walked for every row: all tokens except one trailing {@value #RECORD_TOKEN}, which is implied.
	 *
	 * @return the tokens to walk
	 */
	@NonNull
	public List<String> getWalkTokens() {
		int size = getTokens().size();

		if (size > 0 && RECORD_TOKEN.equals(getTokens().get(size - 1)))
			return getTokens().subList(0, size - 1);

		return getTokens();
	}

	@NonNull
	public Boolean startsWithWildcard() {
		return WILDCARD_TOKEN.equals(getTokens().get(0));
	}

	@NonNull
	public static Boolean isReservedToken(@NonNull String token) {
		requireNonNull(token);
		return WILDCARD_TOKEN.equals(token) || RECORD_TOKEN.equals(token);
	}

	@Override
	public String toString() {
		return getDescriptor();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof AssociativeDescriptor))
			return false;

		return Objects.equals(getDescriptor(), ((AssociativeDescriptor) object).getDescriptor());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getDescriptor());
	}

	@NonNull
	public String getDescriptor() {
		return this.descriptor;
	}

	@NonNull
	public List<String> getTokens() {
		return this.tokens;
	}
}
