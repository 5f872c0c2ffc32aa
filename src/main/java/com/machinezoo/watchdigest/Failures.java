// Part of Watchdigest
package com.machinezoo.watchdigest;

import java.lang.reflect.*;
import com.google.common.base.*;
import com.machinezoo.noexception.*;

/*
 * Watched accessors and user handlers may throw anything including checked exceptions.
 * We pass them through unchanged instead of wrapping, so that callers can catch what their code throws.
 */
class Failures {
	static RuntimeException propagate(Throwable exception) {
		Throwables.throwIfUnchecked(exception);
		if (exception instanceof Exception) {
			Exceptions.sneak().run(() -> {
				throw (Exception)exception;
			});
		}
		return new UndeclaredThrowableException(exception);
	}
}
