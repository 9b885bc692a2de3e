package com.acme.asuc.governor;

/**
 * State holder that can drop everything it has accumulated and start over.
 */
public interface Clearable {
    void clear();
}
