package eu.optima.listino.jpa;

import java.util.function.Function;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityTransaction;

/** Runs work in a resource-local transaction; rolls back and rethrows on failure. */
public class Jpa {

    @FunctionalInterface
    public interface TxVoid {
        void run(EntityManager em);
    }

    public static <R> R tx(Function<EntityManager, R> f) {
        var emf = HibernateUtil.emf();
        try (var em = emf.createEntityManager()) {
            EntityTransaction tx = em.getTransaction();
            tx.begin();
            try {
                R r = f.apply(em);
                tx.commit();
                return r;
            } catch (RuntimeException e) {
                if (tx.isActive())
                    tx.rollback();
                throw e;
            }
        }
    }

    public static void txVoid(TxVoid f) {
        tx(em -> {
            f.run(em);
            return null;
        });
    }
}
