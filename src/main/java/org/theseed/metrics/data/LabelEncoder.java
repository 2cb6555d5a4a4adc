/**
 *
 */
package org.theseed.metrics.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * This class maps arbitrary cluster labels to dense integer codes.  The distinct labels are sorted and
 * numbered from 0.  Numeric labels sort by value, labels of the same comparable type sort naturally, and
 * anything else sorts by type name and then by string form.
 *
 * An encoder is built for one label vector in one metric call.  The truth and prediction vectors always get
 * separate encoders, so their codes are not comparable with each other.
 *
 */
public class LabelEncoder {

    // FIELDS
    /** sorted list of distinct labels; the index of a label is its code */
    private final List<Object> classes;
    /** map from label to code */
    private final Map<Object, Integer> codeMap;

    /** ordering used to sort distinct labels */
    public static final Comparator<Object> LABEL_ORDER = new LabelOrder();

    /**
     * Comparator for sorting labels of unknown type.
     */
    private static class LabelOrder implements Comparator<Object> {

        @Override
        public int compare(Object o1, Object o2) {
            int retVal;
            if (o1 instanceof Number && o2 instanceof Number) {
                retVal = Double.compare(((Number) o1).doubleValue(), ((Number) o2).doubleValue());
            } else if (o1 instanceof Comparable && o1.getClass() == o2.getClass()) {
                retVal = ((Comparable<Object>) o1).compareTo(o2);
            } else {
                retVal = o1.getClass().getName().compareTo(o2.getClass().getName());
                if (retVal == 0)
                    retVal = o1.toString().compareTo(o2.toString());
            }
            return retVal;
        }

    }

    /**
     * Construct an encoder for a set of labels.
     *
     * @param labels	list of labels to encode
     */
    private LabelEncoder(List<?> labels) {
        TreeSet<Object> distinct = new TreeSet<Object>(LABEL_ORDER);
        for (Object label : labels) {
            if (label == null)
                throw new IllegalArgumentException("Cluster labels cannot be null.");
            distinct.add(label);
        }
        this.classes = new ArrayList<Object>(distinct);
        this.codeMap = new HashMap<Object, Integer>(this.classes.size() * 4 / 3 + 1);
        for (int i = 0; i < this.classes.size(); i++)
            this.codeMap.put(this.classes.get(i), i);
    }

    /**
     * @return an encoder fitted to the specified labels
     *
     * @param labels	list of labels to encode
     */
    public static LabelEncoder fit(List<?> labels) {
        return new LabelEncoder(labels);
    }

    /**
     * Encode a list of labels.
     *
     * @param labels	labels to encode
     *
     * @return an array of label codes
     *
     * @throws IllegalArgumentException if a label was not seen when the encoder was fitted
     */
    public int[] transform(List<?> labels) {
        int[] retVal = new int[labels.size()];
        for (int i = 0; i < retVal.length; i++)
            retVal[i] = this.encode(labels.get(i));
        return retVal;
    }

    /**
     * @return the code for a single label
     *
     * @param label		label to encode
     */
    public int encode(Object label) {
        Integer retVal = this.codeMap.get(label);
        if (retVal == null) {
            // Numeric labels of a different boxed type can still match by value.
            int idx = (label == null ? -1 : Collections.binarySearch(this.classes, label, LABEL_ORDER));
            if (idx < 0)
                throw new IllegalArgumentException("Label \"" + label + "\" was not present when the encoder was fitted.");
            retVal = idx;
        }
        return retVal;
    }

    /**
     * @return the original label for a code
     *
     * @param code	code to decode
     */
    public Object decode(int code) {
        return this.classes.get(code);
    }

    /**
     * Decode an array of label codes.
     *
     * @param codes		codes to decode
     *
     * @return a list of the original labels
     */
    public List<Object> inverseTransform(int[] codes) {
        List<Object> retVal = new ArrayList<Object>(codes.length);
        for (int code : codes)
            retVal.add(this.decode(code));
        return retVal;
    }

    /**
     * @return the number of distinct labels
     */
    public int size() {
        return this.classes.size();
    }

    /**
     * @return the sorted list of distinct labels
     */
    public List<Object> getClasses() {
        return Collections.unmodifiableList(this.classes);
    }

}
