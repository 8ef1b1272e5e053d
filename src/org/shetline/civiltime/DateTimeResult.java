/*
  Copyright © 2018 Kerry Shetline, kerry@shetline.com

  MIT license: https://opensource.org/licenses/MIT

  Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated
  documentation files (the "Software"), to deal in the Software without restriction, including without limitation the
  rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit
  persons to whom the Software is furnished to do so, subject to the following conditions:

  The above copyright notice and this permission notice shall be included in all copies or substantial portions of the
  Software.

  THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE
  WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR
  COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR
  OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
*/

package org.shetline.civiltime;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;


/**
 * The outcome of a fallible date-time operation: either a value, or the error that prevented it
 * together with its {@link DateTimeErrorKind}.
 *
 * <pre>
 *   DateTimeResult&lt;LocalDate&gt; result = DateTimeResult.of(() -&gt; LocalDate.of(2012, 2, 30));
 *
 *   if (result.getKind() == DateTimeErrorKind.RANGE) ...
 * </pre>
 */
public final class DateTimeResult<T>
{
  private final T                 value;
  private final DateTimeErrorKind kind;
  private final RuntimeException  error;

  private DateTimeResult(T value, DateTimeErrorKind kind, RuntimeException error)
  {
    this.value = value;
    this.kind = kind;
    this.error = error;
  }

  public static <T> DateTimeResult<T> success(T value)
  {
    return new DateTimeResult<>(Objects.requireNonNull(value, "value"), null, null);
  }

  public static <T> DateTimeResult<T> failure(RuntimeException error)
  {
    Objects.requireNonNull(error, "error");

    return new DateTimeResult<>(null, classify(error), error);
  }

  /**
   * Runs the operation, capturing a date-time, null-argument or arithmetic failure instead of
   * letting it propagate. Other exceptions propagate unchanged.
   */
  public static <T> DateTimeResult<T> of(Supplier<T> operation)
  {
    try {
      return success(operation.get());
    }
    catch (DateTimeException | NullPointerException | ArithmeticException e) {
      return failure(e);
    }
  }

  public static DateTimeErrorKind classify(RuntimeException error)
  {
    if (error instanceof DateTimeException)
      return ((DateTimeException) error).getKind();
    else if (error instanceof NullPointerException)
      return DateTimeErrorKind.NULL_ARGUMENT;
    else if (error instanceof ArithmeticException)
      return DateTimeErrorKind.ARITHMETIC_OVERFLOW;

    throw new IllegalArgumentException("Not a date-time failure: " + error.getClass().getName());
  }

  public boolean isSuccess()
  {
    return error == null;
  }

  public T get()
  {
    if (error != null)
      throw error;

    return value;
  }

  public T orElse(T other)
  {
    return error == null ? value : other;
  }

  public DateTimeErrorKind getKind()
  {
    return kind;
  }

  public RuntimeException getError()
  {
    if (error == null)
      throw new NoSuchElementException("No error present");

    return error;
  }

  public <U> DateTimeResult<U> map(Function<? super T, ? extends U> mapper)
  {
    if (error != null)
      return new DateTimeResult<>(null, kind, error);

    return of(() -> mapper.apply(value));
  }

  @Override
  public String toString()
  {
    return error == null ? "Success[" + value + "]" : "Failure[" + kind + ": " + error.getMessage() + "]";
  }
}
