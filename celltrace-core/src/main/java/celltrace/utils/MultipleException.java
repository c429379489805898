/*
 * Copyright (C) celltrace contributors
 *
 * This File is part of celltrace
 *
 * celltrace is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * celltrace is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with celltrace.  If not, see <http://www.gnu.org/licenses/>.
 */
package celltrace.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregates localized errors. Key of each pair is the source of the error (e.g. "FOV 3").
 */
public class MultipleException extends RuntimeException {
    final private List<Pair<String, Throwable>> exceptions;
    public MultipleException(List<Pair<String, Throwable>> exceptions) {
        this.exceptions= new ArrayList<>();
        addExceptions(exceptions);
    }
    public MultipleException() {
        this.exceptions=new ArrayList<>();
    }
    public void addExceptions(Collection<Pair<String, Throwable>> ex) {
        ex.forEach(this::addException);
    }
    public void addException(String source, Throwable t) {
        addException(new Pair<>(source, t));
    }
    private void addException(Pair<String, Throwable> ex) {
        if (ex==null || ex.value==null || ex.key==null) return;
        exceptions.add(ex);
    }

    public void unroll() {
        List<Pair<String, Throwable>> errorsToAdd = new ArrayList<>();
        Iterator<Pair<String, Throwable>> it = exceptions.iterator();
        while(it.hasNext()) {
            Pair<String, Throwable> e = it.next();
            if (e.value instanceof MultipleException) {
                it.remove();
                ((MultipleException)e.value).unroll();
                errorsToAdd.addAll(((MultipleException)e.value).getExceptions());
            }
        }
        exceptions.addAll(errorsToAdd);
    }

    public List<Pair<String, Throwable>> getExceptions() {
        return exceptions;
    }
    public boolean isEmpty() {
        return exceptions.isEmpty();
    }
    @Override
    public String getMessage() {
        return exceptions.stream().map(p -> p.key + ": " + p.value.getMessage()).collect(Collectors.joining("; "));
    }
}
